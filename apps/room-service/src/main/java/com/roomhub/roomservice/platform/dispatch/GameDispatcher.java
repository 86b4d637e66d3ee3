package com.roomhub.roomservice.platform.dispatch;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.RoomState;
import com.roomhub.roomservice.platform.room.Room;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 通用调度器：按房间的 GameType 找到对应的 GameHandler，
 * 在房间锁内执行动作，平台本身不了解任何一种游戏的规则。
 */
@Slf4j
@Component
public class GameDispatcher {

    private final Map<GameType, GameHandler<?>> handlers = new EnumMap<>(GameType.class);

    public GameDispatcher(List<GameHandler<?>> handlers) {
        for (GameHandler<?> h : handlers) {
            GameHandler<?> prev = this.handlers.put(h.gameType(), h);
            if (prev != null) {
                throw new IllegalStateException("Duplicate handler for " + h.gameType());
            }
        }
        log.info("已注册游戏: {}", this.handlers.keySet());
    }

    public boolean supports(GameType type) {
        return handlers.containsKey(type);
    }

    /** 为新房间创建初始状态 */
    public RoomState createState(GameType type, String roomCode) {
        return handlerFor(type).createState(roomCode);
    }

    /**
     * 执行玩家动作。
     * 房间已销毁抛 RoomNotFoundException，非房间成员抛 IllegalStateException；
     * 规则拒绝通过 MoveResult 返回，状态不变。
     */
    public DispatchResult dispatch(Room room, String playerId, GameAction action) {
        return room.withLock(() -> {
            room.ensureOpen();
            if (!room.isMember(playerId)) {
                throw new IllegalStateException("NOT_IN_ROOM: " + playerId);
            }
            room.touch();
            Binding<?> b = bind(room);
            MoveResult result = b.handle(playerId, action);
            if (result.accepted()) {
                log.debug("动作已接受: room={}, player={}, action={}", room.getCode(), playerId, action);
            } else {
                log.debug("动作被拒绝: room={}, player={}, action={}, reason={}",
                        room.getCode(), playerId, action, result.rejection());
            }
            return new DispatchResult(result, b.snapshot(), room.nextSeq());
        });
    }

    /** 重开（仅房间成员） */
    public DispatchResult restart(Room room, String playerId) {
        return room.withLock(() -> {
            room.ensureOpen();
            if (!room.isMember(playerId)) {
                throw new IllegalStateException("NOT_IN_ROOM: " + playerId);
            }
            room.touch();
            Binding<?> b = bind(room);
            MoveResult result = b.restart();
            log.info("重开: room={}, by={}, accepted={}", room.getCode(), playerId, result.accepted());
            return new DispatchResult(result, b.snapshot(), room.nextSeq());
        });
    }

    public void playerJoined(Room room, String playerId) {
        room.withLock(() -> {
            bind(room).joined(playerId);
            return null;
        });
    }

    public void playerLeft(Room room, String playerId) {
        room.withLock(() -> {
            bind(room).left(playerId);
            return null;
        });
    }

    public Object snapshot(Room room) {
        return room.withLock(() -> bind(room).snapshot());
    }

    /** 当前快照 + 广播序号（成员变化后广播用） */
    public DispatchResult stampedSnapshot(Room room) {
        return room.withLock(() -> new DispatchResult(MoveResult.ok(), bind(room).snapshot(), room.nextSeq()));
    }

    // ----------- private helpers -----------

    private GameHandler<?> handlerFor(GameType type) {
        GameHandler<?> h = handlers.get(type);
        if (h == null) {
            throw new IllegalArgumentException("UNSUPPORTED_GAME_TYPE: " + type);
        }
        return h;
    }

    private Binding<?> bind(Room room) {
        return Binding.of(handlerFor(room.getGameType()), room.getState());
    }

    /** handler + 按 stateType 转换后的状态 */
    private record Binding<S extends RoomState>(GameHandler<S> handler, S state) {

        static <S extends RoomState> Binding<S> of(GameHandler<S> handler, RoomState state) {
            return new Binding<>(handler, handler.stateType().cast(state));
        }

        MoveResult handle(String playerId, GameAction action) {
            return handler.handle(state, playerId, action);
        }

        MoveResult restart() {
            return handler.restart(state);
        }

        void joined(String playerId) {
            handler.onPlayerJoined(state, playerId);
        }

        void left(String playerId) {
            handler.onPlayerLeft(state, playerId);
        }

        Object snapshot() {
            return handler.snapshot(state);
        }
    }
}
