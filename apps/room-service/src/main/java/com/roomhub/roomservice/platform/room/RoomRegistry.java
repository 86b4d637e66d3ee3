package com.roomhub.roomservice.platform.room;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.RoomState;
import com.roomhub.roomservice.platform.dispatch.GameDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 房间注册表（内存）。
 * 负责房间码生成、加入/离开、按房间码查找与空闲清理；
 * 具体游戏状态的创建与玩家进出交给 {@link GameDispatcher}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomRegistry {

    /** 房间码字符集：去掉了容易混淆的 I、O、0、1 */
    public static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private static final int MAX_CODE_ATTEMPTS = 100;

    private final GameDispatcher dispatcher;
    private final RoomProperties properties;
    private final SecureRandom rng = new SecureRandom();

    /** 房间缓存：code -> Room */
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    /**
     * 创建房间，创建者作为 P1 加入。
     */
    public JoinResult create(GameType gameType) {
        if (!dispatcher.supports(gameType)) {
            throw new IllegalArgumentException("UNSUPPORTED_GAME_TYPE: " + gameType);
        }
        Room room = null;
        for (int i = 0; i < MAX_CODE_ATTEMPTS && room == null; i++) {
            String code = generateCode();
            RoomState state = dispatcher.createState(gameType, code);
            Room candidate = new Room(code, gameType, state, Instant.now());
            if (rooms.putIfAbsent(code, candidate) == null) {
                room = candidate;
            }
        }
        if (room == null) {
            throw new IllegalStateException("ROOM_CODE_EXHAUSTED");
        }
        log.info("房间已创建: code={}, game={}", room.getCode(), gameType.key());
        return join(room.getCode());
    }

    /**
     * 加入房间：分配第一个空闲的玩家编号。
     *
     * @throws RoomNotFoundException 房间不存在或已销毁
     * @throws IllegalStateException 房间已满
     */
    public JoinResult join(String code) {
        Room room = get(code);
        String playerId = room.withLock(() -> {
            // 取到房间后、拿到锁之前，房间可能已被最后一人离开或空闲清理销毁
            room.ensureOpen();
            String id = room.claimFreeSlot();
            if (id == null) {
                throw new IllegalStateException("ROOM_FULL: " + room.getCode());
            }
            dispatcher.playerJoined(room, id);
            room.touch();
            return id;
        });
        log.info("玩家加入: room={}, player={}, count={}", room.getCode(), playerId, room.playerCount());
        return new JoinResult(room, playerId);
    }

    /**
     * 离开房间；最后一人离开时销毁房间。
     *
     * @throws RoomNotFoundException 房间不存在或已销毁
     * @throws IllegalStateException 该玩家不在房间内
     */
    public LeaveResult leave(String code, String playerId) {
        Room room = get(code);
        LeaveResult result = room.withLock(() -> {
            room.ensureOpen();
            if (!room.removePlayer(playerId)) {
                throw new IllegalStateException("NOT_IN_ROOM: " + playerId);
            }
            dispatcher.playerLeft(room, playerId);
            room.touch();
            List<String> remaining = room.getPlayers();
            if (remaining.isEmpty()) {
                destroy(room);
                return new LeaveResult(true, remaining);
            }
            return new LeaveResult(false, remaining);
        });
        log.info("玩家离开: room={}, player={}, destroyed={}", room.getCode(), playerId, result.roomDestroyed());
        if (result.roomDestroyed()) {
            log.info("房间已销毁: code={}", room.getCode());
        }
        return result;
    }

    public Optional<Room> find(String code) {
        String key = normalize(code);
        return key == null ? Optional.empty() : Optional.ofNullable(rooms.get(key));
    }

    /**
     * @throws RoomNotFoundException 房间不存在
     */
    public Room get(String code) {
        return find(code).orElseThrow(() -> new RoomNotFoundException(code));
    }

    /** 在房间锁内执行 */
    public <T> T withRoom(String code, Function<Room, T> fn) {
        Room room = get(code);
        return room.withLock(() -> {
            room.ensureOpen();
            return fn.apply(room);
        });
    }

    public int size() {
        return rooms.size();
    }

    /**
     * 清理空闲超过 idleTtl 的房间。
     *
     * @return 被清理的房间数
     */
    public int sweepIdle(Instant now) {
        Instant cutoff = now.minus(properties.getIdleTtl());
        int removed = 0;
        for (Room room : rooms.values()) {
            if (!room.getLastActiveAt().isBefore(cutoff)) {
                continue;
            }
            // 持锁复查：扫描期间房间可能刚被操作过或已被销毁
            boolean swept = room.withLock(() -> {
                if (room.isClosed() || !room.getLastActiveAt().isBefore(cutoff)) {
                    return false;
                }
                destroy(room);
                return true;
            });
            if (swept) {
                removed++;
                log.info("空闲房间已清理: code={}, game={}, lastActiveAt={}",
                        room.getCode(), room.getGameType().key(), room.getLastActiveAt());
            }
        }
        return removed;
    }

    // ----------- private helpers -----------

    /** 持有房间锁时调用：先标记关闭，再从注册表移除 */
    private void destroy(Room room) {
        room.close();
        rooms.remove(room.getCode(), room);
    }

    private String generateCode() {
        int len = Math.max(1, properties.getCodeLength());
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            sb.append(CODE_ALPHABET.charAt(rng.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String normalize(String code) {
        return StringUtils.isBlank(code) ? null : StringUtils.upperCase(code.trim());
    }
}
