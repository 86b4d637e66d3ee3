package com.roomhub.roomservice.games.tictactoe.domain.rule;

import com.roomhub.roomservice.games.tictactoe.domain.enums.Mark;

/** 对局结果：未结束 / X胜 / O胜 / 和棋 */
public enum Outcome {
    ONGOING,
    X_WIN,
    O_WIN,
    DRAW;

    /**
     * 根据标记判断胜方。
     *
     * @param mark X 或 O
     * @return X 返回 {@link #X_WIN}，O 返回 {@link #O_WIN}
     */
    public static Outcome winOf(Mark mark) {
        if (mark == Mark.EMPTY) throw new IllegalArgumentException("EMPTY cannot win");
        return mark == Mark.X ? X_WIN : O_WIN;
    }

    public boolean terminal() {
        return this != ONGOING;
    }
}
