package com.roomhub.roomservice.games.checkers.domain.model;

import com.roomhub.roomservice.engine.board.Cell;
import com.roomhub.roomservice.engine.core.FirstTurnPolicy;
import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.engine.core.RoomState;
import com.roomhub.roomservice.engine.core.SideAssignmentPolicy;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPhase;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPiece;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersSide;
import com.roomhub.roomservice.games.checkers.domain.rule.CheckersRules;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * 跳棋房间状态（状态机）。
 * NOT_STARTED：只有一名等待者；第二名不同玩家加入即开局。
 * ACTIVE：轮流走子，强制吃子，连跳期间 forcedFrom 锁定起点且不换手。
 * GAME_OVER：一方无子或无路可走；离开视为认输。可 restart 重开。
 *
 * 所有校验在写入前完成，被拒绝的动作不改变任何状态。
 */
@Getter
public class CheckersRoomState implements RoomState {

    private final String roomCode;

    @Getter(AccessLevel.NONE)
    private final CheckersGrid grid = new CheckersGrid();

    @Getter(AccessLevel.NONE)
    private final SideAssignmentPolicy sidePolicy;

    @Getter(AccessLevel.NONE)
    private final FirstTurnPolicy firstTurnPolicy;

    private String redPlayerId;
    private String blackPlayerId;
    /** 开局前先到的玩家 */
    private String waitingPlayerId;

    private boolean started;
    private String currentTurnPlayerId;

    private boolean gameOver;
    private String winnerPlayerId;

    /** 连跳中必须继续走的棋子位置 */
    private Cell forcedFrom;
    private Cell lastFrom;
    private Cell lastTo;
    private int moveNumber;

    public CheckersRoomState(String roomCode) {
        this(roomCode, new SecureRandom());
    }

    public CheckersRoomState(String roomCode, Random rng) {
        this(roomCode, SideAssignmentPolicy.random(rng), FirstTurnPolicy.random(rng));
    }

    public CheckersRoomState(String roomCode, SideAssignmentPolicy sidePolicy, FirstTurnPolicy firstTurnPolicy) {
        if (StringUtils.isBlank(roomCode)) {
            throw new IllegalArgumentException("Room code cannot be null or empty.");
        }
        this.roomCode = roomCode;
        this.sidePolicy = Objects.requireNonNull(sidePolicy, "sidePolicy");
        this.firstTurnPolicy = Objects.requireNonNull(firstTurnPolicy, "firstTurnPolicy");
    }

    @Override
    public String roomCode() {
        return roomCode;
    }

    @Override
    public GameType gameType() {
        return GameType.CHECKERS;
    }

    public CheckersPhase phase() {
        if (!started) return CheckersPhase.NOT_STARTED;
        return gameOver ? CheckersPhase.GAME_OVER : CheckersPhase.ACTIVE;
    }

    // --------- 座位 ----------

    /**
     * 玩家加入（幂等）。
     * 第一名成为等待者，第二名不同玩家触发开局；对局已结束且有空位时，新玩家与留下的玩家直接开新局。
     *
     * @return false 表示两边都已有人
     */
    public boolean join(String playerId) {
        if (StringUtils.isBlank(playerId)) {
            return false;
        }
        if (playerId.equals(waitingPlayerId) || sideOf(playerId) != null) {
            return true;
        }
        if (!started) {
            if (waitingPlayerId == null) {
                waitingPlayerId = playerId;
            } else {
                startGame(waitingPlayerId, playerId);
            }
            return true;
        }
        if (redPlayerId != null && blackPlayerId != null) {
            return false;
        }
        String remaining = redPlayerId != null ? redPlayerId : blackPlayerId;
        if (remaining == null) {
            clearToLobby();
            waitingPlayerId = playerId;
        } else {
            startGame(remaining, playerId);
        }
        return true;
    }

    /**
     * 玩家离开：开局前只是忘掉等待者；对局中判对手胜；结束后只解除绑定。
     */
    public void leave(String playerId) {
        if (playerId == null) {
            return;
        }
        if (playerId.equals(waitingPlayerId)) {
            waitingPlayerId = null;
            return;
        }
        CheckersSide side = sideOf(playerId);
        if (side == null) {
            return;
        }
        if (phase() == CheckersPhase.ACTIVE) {
            finish(playerOf(side.opponent()));
        }
        if (side == CheckersSide.RED) redPlayerId = null; else blackPlayerId = null;
    }

    /**
     * 用当前两名玩家重开（重新随机分边与先手）。
     * 只剩一人时回到等待状态。
     */
    public void restart() {
        if (redPlayerId != null && blackPlayerId != null) {
            startGame(redPlayerId, blackPlayerId);
            return;
        }
        String remaining = redPlayerId != null ? redPlayerId : (blackPlayerId != null ? blackPlayerId : waitingPlayerId);
        clearToLobby();
        waitingPlayerId = remaining;
    }

    /** 玩家执哪一方；未绑定返回 null */
    public CheckersSide sideOf(String playerId) {
        if (playerId == null) return null;
        if (playerId.equals(redPlayerId)) return CheckersSide.RED;
        if (playerId.equals(blackPlayerId)) return CheckersSide.BLACK;
        return null;
    }

    public String playerOf(CheckersSide side) {
        return side == CheckersSide.RED ? redPlayerId : blackPlayerId;
    }

    // --------- 走子 ----------

    /**
     * 走一步（普通一步或一次跳吃）。
     * 连跳时每一跳单独调用，forcedFrom 指向必须继续跳的棋子。
     */
    public MoveResult tryMove(String playerId, Cell from, Cell to) {
        if (!started) return MoveResult.rejected(Rejection.GAME_NOT_STARTED);
        if (gameOver) return MoveResult.rejected(Rejection.GAME_OVER);
        if (playerId == null || !playerId.equals(currentTurnPlayerId)) return MoveResult.rejected(Rejection.NOT_YOUR_TURN);
        CheckersSide side = sideOf(playerId);
        if (side == null) return MoveResult.rejected(Rejection.UNKNOWN_PLAYER);
        if (from == null || to == null) return MoveResult.rejected(Rejection.OUT_OF_BOUNDS);

        Rejection rejection = CheckersRules.validate(grid, side, from, to, forcedFrom);
        if (rejection != null) {
            return MoveResult.rejected(rejection);
        }

        apply(side, from, to);
        return MoveResult.ok();
    }

    public CheckersPiece pieceAt(int row, int col) {
        return grid.get(row, col);
    }

    public int pieceCount(CheckersSide side) {
        return CheckersRules.countPieces(grid, side);
    }

    /** 生成只读快照（给前端渲染） */
    public CheckersSnapshot snapshot() {
        return new CheckersSnapshot(
                roomCode,
                phase(),
                grid.rows(),
                grid.board().getColumns(),
                grid.flatten(),
                redPlayerId,
                blackPlayerId,
                waitingPlayerId,
                currentTurnPlayerId,
                gameOver,
                winnerPlayerId,
                forcedFrom,
                lastFrom,
                lastTo,
                moveNumber,
                pieceCount(CheckersSide.RED),
                pieceCount(CheckersSide.BLACK));
    }

    /** 测试用：直接摆局面 */
    CheckersGrid grid() {
        return grid;
    }

    /** 测试用：指定轮到谁 */
    void forceTurn(String playerId) {
        currentTurnPlayerId = playerId;
    }

    // ----------- private helpers -----------

    private void apply(CheckersSide side, Cell from, Cell to) {
        CheckersPiece piece = grid.get(from);
        boolean capture = CheckersRules.isCapture(from, to);
        if (capture) {
            grid.place(CheckersRules.midpoint(from, to), CheckersPiece.EMPTY);
        }
        grid.place(from, CheckersPiece.EMPTY);
        CheckersPiece landed = CheckersRules.promoteIfNeeded(piece, to, grid.rows());
        grid.place(to, landed);

        lastFrom = from;
        lastTo = to;
        moveNumber++;

        // 连跳判断用落子后的棋子（可能刚升王）
        if (capture && CheckersRules.hasCaptureFrom(grid, to, landed)) {
            forcedFrom = to;
        } else {
            forcedFrom = null;
            currentTurnPlayerId = playerOf(side.opponent());
        }

        if (CheckersRules.countPieces(grid, side.opponent()) == 0) {
            finish(playerOf(side));
            return;
        }
        CheckersSide toMove = sideOf(currentTurnPlayerId);
        if (toMove != null && !CheckersRules.hasAnyMove(grid, toMove)) {
            finish(playerOf(toMove.opponent()));
        }
    }

    private void startGame(String first, String second) {
        if (sidePolicy.firstTakesPrimary(first, second)) {
            redPlayerId = first;
            blackPlayerId = second;
        } else {
            redPlayerId = second;
            blackPlayerId = first;
        }
        waitingPlayerId = null;
        grid.setUpStandard();
        started = true;
        gameOver = false;
        winnerPlayerId = null;
        forcedFrom = null;
        lastFrom = null;
        lastTo = null;
        moveNumber = 0;

        String firstTurn = firstTurnPolicy.choose(redPlayerId, blackPlayerId);
        if (!redPlayerId.equals(firstTurn) && !blackPlayerId.equals(firstTurn)) {
            throw new IllegalStateException("FirstTurnPolicy returned a non-seated player: " + firstTurn);
        }
        currentTurnPlayerId = firstTurn;
    }

    private void clearToLobby() {
        grid.clear();
        redPlayerId = null;
        blackPlayerId = null;
        started = false;
        gameOver = false;
        winnerPlayerId = null;
        currentTurnPlayerId = null;
        forcedFrom = null;
        lastFrom = null;
        lastTo = null;
        moveNumber = 0;
    }

    private void finish(String winner) {
        gameOver = true;
        winnerPlayerId = winner;
        currentTurnPlayerId = null;
        forcedFrom = null;
    }
}
