package com.roomhub.roomservice.games.checkers.domain.enums;

/** 跳棋格子内容 */
public enum CheckersPiece {
    EMPTY,
    RED_MAN,
    RED_KING,
    BLACK_MAN,
    BLACK_KING;

    /** 所属方；空格返回 null */
    public CheckersSide side() {
        return switch (this) {
            case RED_MAN, RED_KING -> CheckersSide.RED;
            case BLACK_MAN, BLACK_KING -> CheckersSide.BLACK;
            case EMPTY -> null;
        };
    }

    public boolean isKing() {
        return this == RED_KING || this == BLACK_KING;
    }

    public boolean isMan() {
        return this == RED_MAN || this == BLACK_MAN;
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }
}
