package com.roomhub.roomservice.engine.board;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 通用矩形棋盘坐标系：rows x columns。
 * 只负责坐标：越界检查、(row,col) 与线性下标互转、深浅格判断、遍历所有格子。
 * 不存放棋子，不可变，可在多个格子游戏之间复用（跳棋、以后的棋类）。
 */
@Getter
@EqualsAndHashCode
public final class Board {

    /** 标准 8x8 尺寸（跳棋/国际象棋） */
    public static final int STANDARD_SIZE = 8;

    private final int rows;
    private final int columns;

    public Board(int rows, int columns) {
        if (rows <= 0) throw new IllegalArgumentException("rows must be > 0: " + rows);
        if (columns <= 0) throw new IllegalArgumentException("columns must be > 0: " + columns);
        this.rows = rows;
        this.columns = columns;
    }

    /** 标准 8x8 棋盘 */
    public static Board standard() {
        return new Board(STANDARD_SIZE, STANDARD_SIZE);
    }

    /** 是否在棋盘内 */
    public boolean isInside(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < columns;
    }

    public boolean isInside(Cell cell) {
        return cell != null && isInside(cell.row(), cell.col());
    }

    /** (row,col) 展平为 0 起始的下标（行优先） */
    public int toIndex(int row, int col) {
        requireInside(row, col);
        return row * columns + col;
    }

    /** 下标还原为 (row,col) */
    public Cell fromIndex(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index " + index + " is outside the board (size " + size() + ").");
        }
        return new Cell(index / columns, index % columns);
    }

    /** 格子总数 */
    public int size() {
        return rows * columns;
    }

    /**
     * 按行优先遍历所有格子。
     * 惰性生成，每次 iterator() 都从头开始，可重复遍历。
     */
    public Iterable<Cell> allCells() {
        return () -> new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public Cell next() {
                if (!hasNext()) throw new NoSuchElementException();
                int i = next++;
                return new Cell(i / columns, i % columns);
            }
        };
    }

    /**
     * 深色格：(row + col) 为奇数。(0,0) 为浅色，(0,1) 为深色。
     * 跳棋棋子只摆在深色格上。
     */
    public boolean isDarkSquare(int row, int col) {
        requireInside(row, col);
        return (row + col) % 2 == 1;
    }

    private void requireInside(int row, int col) {
        if (!isInside(row, col)) {
            throw new IndexOutOfBoundsException("Cell (" + row + "," + col + ") is outside the board.");
        }
    }
}
