package com.roomhub.roomservice.games.checkers.domain.rule;

import com.roomhub.roomservice.engine.board.Cell;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPiece;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersSide;
import com.roomhub.roomservice.games.checkers.domain.model.CheckersGrid;

/**
 * 跳棋规则判定。
 * 只包含纯判断逻辑：走法几何、强制吃子、是否还有子可吃/可走；不修改棋盘。
 * - 普通棋子只能向前斜走一格，或向前跳吃；
 * - 王可以沿四个斜向走一格或跳吃；
 * - 只要本方任意棋子能吃，就不允许走普通步。
 */
public final class CheckersRules {

    // 王的 4 个方向：左上、右上、左下、右下
    private static final int[][] KING_DIRS = {
            {-1, -1}, {-1, 1},
            { 1, -1}, { 1, 1}
    };

    private CheckersRules() {
    }

    /**
     * 校验 from -> to 的走法几何与吃子规则（轮次、开局等由状态对象先行判断）。
     *
     * @param forcedFrom 连跳中必须继续移动的棋子位置，可为 null
     * @return null 表示合法，否则为拒绝原因
     */
    public static Rejection validate(CheckersGrid g, CheckersSide side, Cell from, Cell to, Cell forcedFrom) {
        if (!g.inBounds(from) || !g.inBounds(to)) return Rejection.OUT_OF_BOUNDS;
        if (from.equals(to)) return Rejection.SAME_SQUARE;

        CheckersPiece piece = g.get(from);
        if (piece.isEmpty()) return Rejection.NO_PIECE;
        if (!side.owns(piece)) return Rejection.NOT_YOUR_PIECE;
        if (forcedFrom != null && !forcedFrom.equals(from)) return Rejection.MUST_CONTINUE_CAPTURE;
        if (!g.get(to).isEmpty()) return Rejection.CELL_OCCUPIED;

        int dRow = to.row() - from.row();
        int dCol = to.col() - from.col();
        if (Math.abs(dRow) != Math.abs(dCol)) return Rejection.NOT_DIAGONAL;

        boolean isCapture = Math.abs(dRow) == 2;
        boolean isStep = Math.abs(dRow) == 1;
        if (!isCapture && !isStep) return Rejection.BAD_DISTANCE;

        if (piece.isMan() && Integer.signum(dRow) != side.forward()) return Rejection.MEN_MOVE_FORWARD;

        if (!isCapture) {
            return hasAnyCapture(g, side) ? Rejection.CAPTURE_REQUIRED : null;
        }

        CheckersPiece jumped = g.get(midpoint(from, to));
        if (jumped.isEmpty()) return Rejection.NOTHING_TO_CAPTURE;
        if (side.owns(jumped)) return Rejection.CANNOT_CAPTURE_OWN;
        return null;
    }

    /** 是否为跳吃（两格斜跳） */
    public static boolean isCapture(Cell from, Cell to) {
        return Math.abs(to.row() - from.row()) == 2;
    }

    /** 被跳过的格子 */
    public static Cell midpoint(Cell from, Cell to) {
        return new Cell((from.row() + to.row()) / 2, (from.col() + to.col()) / 2);
    }

    /** 落点为升王行时，普通棋子升王；其余原样返回 */
    public static CheckersPiece promoteIfNeeded(CheckersPiece piece, Cell landing, int rows) {
        CheckersSide side = piece.side();
        if (piece.isMan() && landing.row() == side.promotionRow(rows)) {
            return side.king();
        }
        return piece;
    }

    /** 该棋子从 from 出发是否还能吃子 */
    public static boolean hasCaptureFrom(CheckersGrid g, Cell from, CheckersPiece piece) {
        CheckersSide side = piece.side();
        if (side == null) return false;
        for (int[] d : directionsOf(piece)) {
            Cell mid = from.offset(d[0], d[1]);
            Cell landing = from.offset(2 * d[0], 2 * d[1]);
            if (!g.inBounds(mid) || !g.inBounds(landing)) continue;
            if (g.get(mid).side() == side.opponent() && g.get(landing).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** 该棋子从 from 出发是否有普通一步 */
    public static boolean hasSimpleMoveFrom(CheckersGrid g, Cell from, CheckersPiece piece) {
        for (int[] d : directionsOf(piece)) {
            if (g.isEmpty(from.offset(d[0], d[1]))) {
                return true;
            }
        }
        return false;
    }

    /** 本方任意棋子是否能吃子（强制吃子判断） */
    public static boolean hasAnyCapture(CheckersGrid g, CheckersSide side) {
        for (Cell c : g.board().allCells()) {
            CheckersPiece p = g.get(c);
            if (side.owns(p) && hasCaptureFrom(g, c, p)) {
                return true;
            }
        }
        return false;
    }

    /** 本方是否还有任何合法着法（普通步或吃子） */
    public static boolean hasAnyMove(CheckersGrid g, CheckersSide side) {
        for (Cell c : g.board().allCells()) {
            CheckersPiece p = g.get(c);
            if (side.owns(p) && (hasSimpleMoveFrom(g, c, p) || hasCaptureFrom(g, c, p))) {
                return true;
            }
        }
        return false;
    }

    /** 本方剩余棋子数 */
    public static int countPieces(CheckersGrid g, CheckersSide side) {
        int n = 0;
        for (Cell c : g.board().allCells()) {
            if (side.owns(g.get(c))) n++;
        }
        return n;
    }

    // ----------- private helpers -----------

    /** 普通棋子只有前方两个斜向，王四个斜向都可以 */
    private static int[][] directionsOf(CheckersPiece piece) {
        if (piece.isKing()) return KING_DIRS;
        int f = piece.side().forward();
        return new int[][]{{f, -1}, {f, 1}};
    }
}
