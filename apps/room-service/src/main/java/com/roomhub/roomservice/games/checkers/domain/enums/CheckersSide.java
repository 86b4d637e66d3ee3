package com.roomhub.roomservice.games.checkers.domain.enums;

/**
 * 跳棋双方。
 * 棋盘朝向：黑方在上（0~2 行）向下走，红方在下（5~7 行）向上走。
 */
public enum CheckersSide {
    /** 红方：向上（行号减小），到第 0 行升王 */
    RED(-1),
    /** 黑方：向下（行号增大），到最后一行升王 */
    BLACK(+1);

    private final int forward;

    CheckersSide(int forward) {
        this.forward = forward;
    }

    /** 普通棋子的前进方向（行增量） */
    public int forward() {
        return forward;
    }

    /** 升王所在行 */
    public int promotionRow(int boardRows) {
        return this == RED ? 0 : boardRows - 1;
    }

    public CheckersSide opponent() {
        return this == RED ? BLACK : RED;
    }

    public CheckersPiece man() {
        return this == RED ? CheckersPiece.RED_MAN : CheckersPiece.BLACK_MAN;
    }

    public CheckersPiece king() {
        return this == RED ? CheckersPiece.RED_KING : CheckersPiece.BLACK_KING;
    }

    public boolean owns(CheckersPiece piece) {
        return piece != null && piece.side() == this;
    }
}
