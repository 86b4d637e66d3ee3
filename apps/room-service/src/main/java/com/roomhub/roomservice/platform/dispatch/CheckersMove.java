package com.roomhub.roomservice.platform.dispatch;

import com.roomhub.roomservice.engine.board.Cell;

/** 跳棋走一步（连跳时每跳一次发一条） */
public record CheckersMove(int fromRow, int fromCol, int toRow, int toCol) implements GameAction {

    public Cell from() {
        return Cell.of(fromRow, fromCol);
    }

    public Cell to() {
        return Cell.of(toRow, toCol);
    }
}
