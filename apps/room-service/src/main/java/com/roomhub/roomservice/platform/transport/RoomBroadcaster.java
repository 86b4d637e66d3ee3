package com.roomhub.roomservice.platform.transport;

import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.platform.dispatch.DispatchResult;
import com.roomhub.roomservice.platform.room.Room;
import com.roomhub.roomservice.platform.ws.WebSocketStompConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 房间广播：所有消息发到 /topic/room.{code}，外层统一用 {@link Envelope} 包装。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomBroadcaster {

    public static final String TOPIC_PREFIX = WebSocketStompConfig.BROKER_PREFIX + "/room.";
    /** 房间不存在时 Envelope.game 的占位值 */
    public static final String UNKNOWN_GAME = "unknown";

    private final SimpMessagingTemplate messaging;

    public static String topic(String roomCode) {
        return TOPIC_PREFIX + roomCode;
    }

    /** 广播完整快照，seq 取自调度结果 */
    public void sendState(Room room, DispatchResult r) {
        messaging.convertAndSend(topic(room.getCode()),
                Envelope.state(room.getGameType().key(), room.getCode(), r.snapshot(), r.seq()));
    }

    /** 广播规则拒绝 */
    public void sendRejection(Room room, String playerId, DispatchResult r) {
        MoveResult result = r.result();
        RejectionPayload payload = new RejectionPayload(result.rejection().name(), result.message(), playerId);
        messaging.convertAndSend(topic(room.getCode()),
                Envelope.error(room.getGameType().key(), room.getCode(), payload, r.seq()));
    }

    /** 广播一般错误（房间不存在、非成员等） */
    public void sendError(String roomCode, String game, String playerId, String message) {
        if (roomCode == null) {
            log.warn("丢弃无房间码的错误消息: {}", message);
            return;
        }
        RejectionPayload payload = new RejectionPayload("ERROR", message, playerId);
        messaging.convertAndSend(topic(roomCode), Envelope.error(game, roomCode, payload, 0));
    }
}
