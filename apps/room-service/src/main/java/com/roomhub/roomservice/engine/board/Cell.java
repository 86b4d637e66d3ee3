package com.roomhub.roomservice.engine.board;

/**
 * 棋盘上的一个格子 (row, col)。
 * 不可变 record；“可选坐标”一律用 Cell（可为 null）表达，不用两个可空整数。
 */
public record Cell(int row, int col) {

    public static Cell of(int row, int col) {
        return new Cell(row, col);
    }

    /** 沿 (dRow, dCol) 偏移后的格子（不做越界判断） */
    public Cell offset(int dRow, int dCol) {
        return new Cell(row + dRow, col + dCol);
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
