package com.roomhub.roomservice.games.checkers.domain.model;

import com.roomhub.roomservice.engine.board.Board;
import com.roomhub.roomservice.engine.board.Cell;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPiece;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersSide;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 跳棋棋盘：8x8 网格，坐标系委托给通用 {@link Board}。
 * 只存放棋子，不做合法性校验，规则放在 rule 包。
 */
public class CheckersGrid {

    /** 每方开局占据的行数 */
    public static final int STARTING_RANKS = 3;

    private final Board board;
    private final CheckersPiece[][] grid;

    public CheckersGrid() {
        this(Board.standard());
    }

    public CheckersGrid(Board board) {
        this.board = board;
        this.grid = new CheckersPiece[board.getRows()][board.getColumns()];
        clear();
    }

    public Board board() {
        return board;
    }

    public int rows() {
        return board.getRows();
    }

    /** 是否在棋盘内 */
    public boolean inBounds(Cell c) {
        return board.isInside(c);
    }

    /** 读取该格棋子 */
    public CheckersPiece get(Cell c) {
        return grid[c.row()][c.col()];
    }

    public CheckersPiece get(int row, int col) {
        return grid[row][col];
    }

    /** 该格是否为空（越界视为不可落） */
    public boolean isEmpty(Cell c) {
        return inBounds(c) && get(c) == CheckersPiece.EMPTY;
    }

    /** 直接放置（不做合法性校验） */
    public void place(Cell c, CheckersPiece piece) {
        grid[c.row()][c.col()] = piece;
    }

    public void clear() {
        for (CheckersPiece[] row : grid) Arrays.fill(row, CheckersPiece.EMPTY);
    }

    /**
     * 标准开局：黑方占 0~2 行、红方占最后 3 行，只摆在深色格上。
     */
    public void setUpStandard() {
        clear();
        int rows = board.getRows();
        for (Cell c : board.allCells()) {
            if (!board.isDarkSquare(c.row(), c.col())) continue;
            if (c.row() < STARTING_RANKS) {
                place(c, CheckersSide.BLACK.man());
            } else if (c.row() >= rows - STARTING_RANKS) {
                place(c, CheckersSide.RED.man());
            }
        }
    }

    /** 行优先展平的只读视图（用于快照） */
    public List<CheckersPiece> flatten() {
        List<CheckersPiece> out = new ArrayList<>(board.size());
        for (Cell c : board.allCells()) out.add(get(c));
        return out;
    }
}
