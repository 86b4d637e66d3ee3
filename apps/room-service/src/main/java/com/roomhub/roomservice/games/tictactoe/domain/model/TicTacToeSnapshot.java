package com.roomhub.roomservice.games.tictactoe.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.roomhub.roomservice.games.tictactoe.domain.enums.Mark;

import java.util.List;

/**
 * 井字棋房间的只读快照（广播给前端）。
 * cells 为 9 格副本，下标 = row * 3 + col。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicTacToeSnapshot(
        String roomCode,
        List<Mark> cells,
        String currentPlayerId,
        String playerXId,
        String playerOId,
        boolean gameOver,
        String winnerPlayerId,
        boolean draw,
        int moveCount) {

    public TicTacToeSnapshot {
        cells = List.copyOf(cells);
    }
}
