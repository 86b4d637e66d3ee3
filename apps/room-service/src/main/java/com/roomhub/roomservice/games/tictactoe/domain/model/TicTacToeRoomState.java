package com.roomhub.roomservice.games.tictactoe.domain.model;

import com.roomhub.roomservice.engine.core.FirstTurnPolicy;
import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.engine.core.RoomState;
import com.roomhub.roomservice.games.tictactoe.domain.enums.Mark;
import com.roomhub.roomservice.games.tictactoe.domain.rule.Outcome;
import com.roomhub.roomservice.games.tictactoe.domain.rule.TicTacToeJudge;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * 井字棋房间状态。
 * 作用：整局的“单一事实来源”（9 格、轮到谁、X/O 绑定、是否结束、赢家/和棋）。
 * - 先加入者执 X（房主），后加入者执 O；
 * - 两方都就座后由 FirstTurnPolicy 决定先手（默认 X 先）；
 * - 每次被接受的落子只修改一次状态，结束后不再接受落子。
 */
@Getter
public class TicTacToeRoomState implements RoomState {

    public static final int CELL_COUNT = 9;

    private final String roomCode;

    @Getter(AccessLevel.NONE)
    private final Mark[] cells = new Mark[CELL_COUNT];

    @Getter(AccessLevel.NONE)
    private final FirstTurnPolicy firstTurnPolicy;

    /** 当前应走玩家；X 就座后即为 X，O 就座后由策略决定 */
    private String currentPlayerId;

    private String playerXId;
    private String playerOId;

    private boolean gameOver;
    /** 赢家玩家ID；未结束或和棋为 null */
    private String winnerPlayerId;
    private boolean draw;

    /** 本局已接受的落子数 */
    private int moveCount;

    public TicTacToeRoomState(String roomCode) {
        this(roomCode, FirstTurnPolicy.primaryFirst());
    }

    public TicTacToeRoomState(String roomCode, FirstTurnPolicy firstTurnPolicy) {
        if (StringUtils.isBlank(roomCode)) {
            throw new IllegalArgumentException("Room code cannot be null or empty.");
        }
        this.roomCode = roomCode;
        this.firstTurnPolicy = Objects.requireNonNull(firstTurnPolicy, "firstTurnPolicy");
        Arrays.fill(cells, Mark.EMPTY);
    }

    @Override
    public String roomCode() {
        return roomCode;
    }

    @Override
    public GameType gameType() {
        return GameType.TIC_TAC_TOE;
    }

    // --------- 座位 ----------

    /**
     * 为玩家分配标记（幂等）：已就座返回原标记；否则先 X 后 O；两边都满返回 empty。
     */
    public Optional<Mark> seatPlayer(String playerId) {
        if (StringUtils.isBlank(playerId)) {
            return Optional.empty();
        }
        Mark existing = markOf(playerId);
        if (existing != Mark.EMPTY) {
            return Optional.of(existing);
        }
        if (playerXId == null) {
            playerXId = playerId;
            seatChanged();
            return Optional.of(Mark.X);
        }
        if (playerOId == null) {
            playerOId = playerId;
            seatChanged();
            return Optional.of(Mark.O);
        }
        return Optional.empty();
    }

    /**
     * 玩家离座。进行中的对局判离开者负。
     */
    public void unseatPlayer(String playerId) {
        Mark mark = markOf(playerId);
        if (mark == Mark.EMPTY) {
            return;
        }
        if (inProgress()) {
            forfeit(playerId);
        }
        if (mark == Mark.X) playerXId = null; else playerOId = null;
        if (!gameOver) {
            currentPlayerId = playerXId != null ? playerXId : playerOId;
        }
    }

    /** 该玩家执哪个标记；不在座返回 EMPTY */
    public Mark markOf(String playerId) {
        if (playerId == null) return Mark.EMPTY;
        if (playerId.equals(playerXId)) return Mark.X;
        if (playerId.equals(playerOId)) return Mark.O;
        return Mark.EMPTY;
    }

    /** 两边都已就座且未结束 */
    public boolean inProgress() {
        return playerXId != null && playerOId != null && !gameOver;
    }

    // --------- 状态变更 ----------

    /**
     * 在 cellIndex（0..8）落子。
     * 拒绝时返回原因且状态不变：已结束、未凑齐两人、非本局玩家、未轮到、越界、已占。
     */
    public MoveResult tryMove(String playerId, int cellIndex) {
        if (gameOver) return MoveResult.rejected(Rejection.GAME_OVER);
        if (playerXId == null || playerOId == null) return MoveResult.rejected(Rejection.GAME_NOT_STARTED);
        Mark mark = markOf(playerId);
        if (mark == Mark.EMPTY) return MoveResult.rejected(Rejection.UNKNOWN_PLAYER);
        if (!playerId.equals(currentPlayerId)) return MoveResult.rejected(Rejection.NOT_YOUR_TURN);
        if (!TicTacToeJudge.inBounds(cellIndex)) return MoveResult.rejected(Rejection.OUT_OF_BOUNDS);
        if (cells[cellIndex] != Mark.EMPTY) return MoveResult.rejected(Rejection.CELL_OCCUPIED);

        cells[cellIndex] = mark;
        moveCount++;

        Outcome outcome = TicTacToeJudge.outcomeAfterMove(cells, mark);
        switch (outcome) {
            case X_WIN, O_WIN -> finish(playerId, false);
            case DRAW -> finish(null, true);
            default -> currentPlayerId = (mark == Mark.X) ? playerOId : playerXId;
        }
        return MoveResult.ok();
    }

    /** 认输/离开：未结束的对局判对手胜 */
    public void forfeit(String playerId) {
        Mark mark = markOf(playerId);
        if (gameOver || mark == Mark.EMPTY) {
            return;
        }
        String opponent = (mark == Mark.X) ? playerOId : playerXId;
        finish(opponent, false);
    }

    /** 重开一盘：清空棋盘与结果，保留 X/O 绑定 */
    public void reset() {
        Arrays.fill(cells, Mark.EMPTY);
        gameOver = false;
        winnerPlayerId = null;
        draw = false;
        moveCount = 0;
        seatChanged();
    }

    // --------- 读方法 ----------

    public Mark cellAt(int index) {
        return cells[index];
    }

    /** 棋盘副本，外部修改不影响实盘 */
    public Mark[] cells() {
        return cells.clone();
    }

    /** 生成只读快照（给前端渲染） */
    public TicTacToeSnapshot snapshot() {
        return new TicTacToeSnapshot(
                roomCode,
                Arrays.asList(cells.clone()),
                currentPlayerId,
                playerXId,
                playerOId,
                gameOver,
                winnerPlayerId,
                draw,
                moveCount);
    }

    private void finish(String winner, boolean isDraw) {
        gameOver = true;
        winnerPlayerId = winner;
        draw = isDraw;
        currentPlayerId = null;
    }

    /** 就座后更新轮次；已结束的对局保持 currentPlayerId 为空，等 reset */
    private void seatChanged() {
        if (gameOver) {
            return;
        }
        if (playerXId != null && playerOId != null) {
            chooseFirstTurn();
        } else {
            currentPlayerId = playerXId != null ? playerXId : playerOId;
        }
    }

    private void chooseFirstTurn() {
        String first = firstTurnPolicy.choose(playerXId, playerOId);
        if (!playerXId.equals(first) && !playerOId.equals(first)) {
            throw new IllegalStateException("FirstTurnPolicy returned a non-seated player: " + first);
        }
        currentPlayerId = first;
    }
}
