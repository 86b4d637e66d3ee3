package com.roomhub.roomservice.interfaces.ws.dto;

import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackAction;
import lombok.Data;

/**
 * WebSocket 指令（客户端 → 服务端）。
 * 玩家身份用加入房间时拿到的 playerId（P1..P4）。
 */
public class RoomMessages {

    /** 井字棋落子：/app/tictactoe.move */
    @Data
    public static class TicTacToeMoveCmd {
        private String roomCode;
        private String playerId;
        private int cellIndex;   // 0..8，row * 3 + col
    }

    /** 跳棋走子：/app/checkers.move；连跳时每一跳单独发送 */
    @Data
    public static class CheckersMoveCmd {
        private String roomCode;
        private String playerId;
        private int fromRow;
        private int fromCol;
        private int toRow;
        private int toCol;
    }

    /** 21 点：/app/blackjack.action */
    @Data
    public static class BlackjackActionCmd {
        private String roomCode;
        private String playerId;
        private BlackjackAction action;
    }
}
