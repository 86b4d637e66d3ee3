package com.roomhub.roomservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（所有游戏共用）
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / game / roomCode / payload / ts / seq
 *
 * 用法示例：
 *   Envelope<CheckersSnapshot> msg = Envelope.state("checkers", code, snapshot, seq);
 *   Envelope<RejectionPayload> err = Envelope.error("checkers", code, payload, seq);
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    /** STATE=完整快照，ERROR=动作被拒绝或出错 */
    public enum Kind { STATE, ERROR }

    private final Kind kind;
    private final String game;     // tictactoe / checkers / blackjack
    private final String roomCode;
    private final T payload;
    private final long ts;         // 服务器时间戳（ms）
    private final long seq;        // 房间内递增序号，没有就传 0

    private Envelope(Kind kind, String game, String roomCode, T payload, long ts, long seq) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.game = Objects.requireNonNull(game, "game");
        this.roomCode = Objects.requireNonNull(roomCode, "roomCode");
        this.payload = payload;
        this.ts = ts;
        this.seq = seq;
    }

    public static <T> Envelope<T> of(Kind kind, String game, String roomCode, T payload, long seq) {
        return new Envelope<>(kind, game, roomCode, payload, Instant.now().toEpochMilli(), seq);
    }

    public static <T> Envelope<T> state(String game, String roomCode, T payload, long seq) {
        return of(Kind.STATE, game, roomCode, payload, seq);
    }

    public static <T> Envelope<T> error(String game, String roomCode, T payload, long seq) {
        return of(Kind.ERROR, game, roomCode, payload, seq);
    }

    // Jackson 通过 getter 序列化
    public Kind getKind()       { return kind; }
    public String getGame()     { return game; }
    public String getRoomCode() { return roomCode; }
    public T getPayload()       { return payload; }
    public long getTs()         { return ts; }
    public long getSeq()        { return seq; }

    @Override public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", game='" + game + '\'' +
                ", roomCode='" + roomCode + '\'' +
                ", ts=" + ts +
                ", seq=" + seq +
                '}';
    }
}
