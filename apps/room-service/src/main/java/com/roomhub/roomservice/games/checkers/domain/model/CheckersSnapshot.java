package com.roomhub.roomservice.games.checkers.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.roomhub.roomservice.engine.board.Cell;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPhase;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPiece;

import java.util.List;

/**
 * 跳棋房间的只读快照。
 * cells 为行优先展平的棋盘，下标 = row * columns + col；
 * forcedFrom 非空时前端只允许拖动这一枚棋子。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckersSnapshot(
        String roomCode,
        CheckersPhase phase,
        int rows,
        int columns,
        List<CheckersPiece> cells,
        String redPlayerId,
        String blackPlayerId,
        String waitingPlayerId,
        String currentTurnPlayerId,
        boolean gameOver,
        String winnerPlayerId,
        Cell forcedFrom,
        Cell lastFrom,
        Cell lastTo,
        int moveNumber,
        int redPieces,
        int blackPieces) {

    public CheckersSnapshot {
        cells = List.copyOf(cells);
    }
}
