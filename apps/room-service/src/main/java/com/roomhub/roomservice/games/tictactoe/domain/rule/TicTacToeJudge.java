package com.roomhub.roomservice.games.tictactoe.domain.rule;

import com.roomhub.roomservice.games.tictactoe.domain.enums.Mark;

/**
 * 井字棋规则判定。
 * 只包含纯判断逻辑：胜负、和棋；不修改棋盘。
 * 格子下标约定：index = row * 3 + col。
 */
public final class TicTacToeJudge {

    /** 全部 8 条连线（按下标） */
    static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},   // 横
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},   // 竖
            {0, 4, 8}, {2, 4, 6}               // 对角
    };

    private TicTacToeJudge() {
    }

    /** 下标是否在 0..8 */
    public static boolean inBounds(int index) {
        return index >= 0 && index < 9;
    }

    /** mark 是否占满任意一条线 */
    public static boolean hasLine(Mark[] cells, Mark mark) {
        for (int[] line : LINES) {
            if (cells[line[0]] == mark && cells[line[1]] == mark && cells[line[2]] == mark) {
                return true;
            }
        }
        return false;
    }

    /** 棋盘是否已满 */
    public static boolean isFull(Mark[] cells) {
        for (Mark c : cells) {
            if (c == Mark.EMPTY) return false;
        }
        return true;
    }

    /**
     * 根据“落完这一手”后的局面返回结果。
     * 先查 8 条线，没有胜者时才按满盘判和。
     */
    public static Outcome outcomeAfterMove(Mark[] cells, Mark mover) {
        if (hasLine(cells, mover)) {
            return Outcome.winOf(mover);
        }
        if (isFull(cells)) {
            return Outcome.DRAW;
        }
        return Outcome.ONGOING;
    }
}
