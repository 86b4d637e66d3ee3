package com.roomhub.roomservice.games.tictactoe.domain.enums;

/**
 * 井字棋格子标记。
 * 约定：EMPTY='.', X=房主（先加入者）, O=后加入者
 */
public enum Mark {
    EMPTY('.'),
    X('X'),
    O('O');

    private final char symbol;

    Mark(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public Mark opponent() {
        return switch (this) {
            case X -> O;
            case O -> X;
            case EMPTY -> EMPTY;
        };
    }
}
