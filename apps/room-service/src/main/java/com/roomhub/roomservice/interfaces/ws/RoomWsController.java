package com.roomhub.roomservice.interfaces.ws;

import com.roomhub.roomservice.interfaces.ws.dto.RoomMessages.BlackjackActionCmd;
import com.roomhub.roomservice.interfaces.ws.dto.RoomMessages.CheckersMoveCmd;
import com.roomhub.roomservice.interfaces.ws.dto.RoomMessages.TicTacToeMoveCmd;
import com.roomhub.roomservice.platform.dispatch.BlackjackCommand;
import com.roomhub.roomservice.platform.dispatch.CheckersMove;
import com.roomhub.roomservice.platform.dispatch.DispatchResult;
import com.roomhub.roomservice.platform.dispatch.GameAction;
import com.roomhub.roomservice.platform.dispatch.GameDispatcher;
import com.roomhub.roomservice.platform.dispatch.TicTacToeMove;
import com.roomhub.roomservice.platform.room.Room;
import com.roomhub.roomservice.platform.room.RoomNotFoundException;
import com.roomhub.roomservice.platform.room.RoomRegistry;
import com.roomhub.roomservice.platform.transport.RoomBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

/**
 * 房间 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/... 的游戏指令，交给 GameDispatcher 执行，
 * 接受后广播最新快照（STATE），被拒绝时广播原因（ERROR）。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class RoomWsController {

    private final RoomRegistry registry;
    private final GameDispatcher dispatcher;
    private final RoomBroadcaster broadcaster;

    @MessageMapping("/tictactoe.move")
    public void tictactoeMove(TicTacToeMoveCmd cmd) {
        act(cmd.getRoomCode(), cmd.getPlayerId(), new TicTacToeMove(cmd.getCellIndex()));
    }

    @MessageMapping("/checkers.move")
    public void checkersMove(CheckersMoveCmd cmd) {
        act(cmd.getRoomCode(), cmd.getPlayerId(),
                new CheckersMove(cmd.getFromRow(), cmd.getFromCol(), cmd.getToRow(), cmd.getToCol()));
    }

    @MessageMapping("/blackjack.action")
    public void blackjackAction(BlackjackActionCmd cmd) {
        if (cmd.getAction() == null) {
            broadcaster.sendError(cmd.getRoomCode(), RoomBroadcaster.UNKNOWN_GAME, cmd.getPlayerId(), "action is required");
            return;
        }
        act(cmd.getRoomCode(), cmd.getPlayerId(), new BlackjackCommand(cmd.getAction()));
    }

    private void act(String roomCode, String playerId, GameAction action) {
        Room room;
        try {
            room = registry.get(roomCode);
        } catch (RoomNotFoundException e) {
            broadcaster.sendError(roomCode, RoomBroadcaster.UNKNOWN_GAME, playerId, e.getMessage());
            return;
        }
        try {
            DispatchResult r = dispatcher.dispatch(room, playerId, action);
            if (r.accepted()) {
                broadcaster.sendState(room, r);
            } else {
                broadcaster.sendRejection(room, playerId, r);
            }
        } catch (RoomNotFoundException | IllegalStateException | IllegalArgumentException e) {
            log.debug("动作处理失败: room={}, player={}, error={}", room.getCode(), playerId, e.getMessage());
            broadcaster.sendError(room.getCode(), room.getGameType().key(), playerId, e.getMessage());
        }
    }
}
