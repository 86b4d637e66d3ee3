package com.roomhub.roomservice.platform.room;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.RoomState;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 游戏房间实体。
 * 一个房间只承载一局游戏的状态；所有修改都在 {@link #withLock} 内进行。
 */
@Getter
public class Room {

    /** 玩家ID前缀：P1, P2 ... */
    public static final String PLAYER_ID_PREFIX = "P";

    // ---- 基本信息 ----
    private final String code;
    private final GameType gameType;
    private final RoomState state;
    private final Instant createdAt;

    /** 按加入顺序的玩家ID */
    private final List<String> players = new ArrayList<>();

    private volatile Instant lastActiveAt;

    /** 已从注册表移除；只在持锁时置位，之后不再接受任何修改 */
    private volatile boolean closed;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    /** 广播序号，房间内递增 */
    @Getter(AccessLevel.NONE)
    private final AtomicLong seq = new AtomicLong();

    public Room(String code, GameType gameType, RoomState state, Instant now) {
        this.code = code;
        this.gameType = gameType;
        this.state = state;
        this.createdAt = now;
        this.lastActiveAt = now;
    }

    /** 持有房间锁执行 */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void touch() {
        lastActiveAt = Instant.now();
    }

    public boolean isMember(String playerId) {
        return withLock(() -> playerId != null && players.contains(playerId));
    }

    public List<String> getPlayers() {
        return withLock(() -> List.copyOf(players));
    }

    public int playerCount() {
        return withLock(players::size);
    }

    public boolean isFull() {
        return playerCount() >= gameType.maxPlayers();
    }

    /** 下一个广播序号；与快照在同一次持锁内取，保证序号顺序与状态顺序一致 */
    public long nextSeq() {
        return seq.incrementAndGet();
    }

    /**
     * 持锁时确认房间仍然有效。
     *
     * @throws RoomNotFoundException 房间已销毁或被清理
     */
    public void ensureOpen() {
        if (closed) {
            throw new RoomNotFoundException(code);
        }
    }

    /** 标记为已销毁，调用方必须持有房间锁 */
    void close() {
        closed = true;
    }

    /** 是否有线程在等房间锁（测试用） */
    boolean hasQueuedThreads() {
        return lock.hasQueuedThreads();
    }

    /** 占用第一个空闲编号 P1..Pmax；满员返回 null */
    String claimFreeSlot() {
        return withLock(() -> {
            for (int i = 1; i <= gameType.maxPlayers(); i++) {
                String id = PLAYER_ID_PREFIX + i;
                if (!players.contains(id)) {
                    players.add(id);
                    return id;
                }
            }
            return null;
        });
    }

    boolean removePlayer(String playerId) {
        return withLock(() -> players.remove(playerId));
    }
}
