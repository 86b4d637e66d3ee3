package com.roomhub.roomservice.interfaces.http;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.platform.dispatch.DispatchResult;
import com.roomhub.roomservice.platform.dispatch.GameDispatcher;
import com.roomhub.roomservice.platform.room.JoinResult;
import com.roomhub.roomservice.platform.room.LeaveResult;
import com.roomhub.roomservice.platform.room.Room;
import com.roomhub.roomservice.platform.room.RoomRegistry;
import com.roomhub.roomservice.platform.transport.RoomBroadcaster;
import com.roomhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 房间 http 接口：建房、加入、离开、重开、查看快照。
 * 成员变化会通过 WebSocket 广播最新快照，房间内其他人立刻可见。
 */
@Slf4j
@RestController
@RequestMapping("/api/rooms")
public class RoomRestController {

    private final RoomRegistry registry;
    private final GameDispatcher dispatcher;
    private final RoomBroadcaster broadcaster;

    public RoomRestController(RoomRegistry registry,
                              GameDispatcher dispatcher,
                              RoomBroadcaster broadcaster) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.broadcaster = broadcaster;
    }

    /**
     * 新建房间，创建者成为 P1。
     * gameType 接受 tictactoe / checkers / blackjack（大小写不敏感）。
     */
    @PostMapping
    public ResponseEntity<ApiResponse<RoomJoinResponse>> create(@RequestParam("gameType") String gameType) {
        JoinResult joined = registry.create(GameType.parse(gameType));
        return ResponseEntity.ok(ApiResponse.success(RoomJoinResponse.of(joined)));
    }

    /**
     * 加入房间，分配第一个空闲的玩家编号；满员返回 409。
     */
    @PostMapping("/{code}/join")
    public ResponseEntity<ApiResponse<RoomJoinResponse>> join(@PathVariable String code) {
        JoinResult joined = registry.join(code);
        Room room = joined.room();
        broadcaster.sendState(room, dispatcher.stampedSnapshot(room));
        return ResponseEntity.ok(ApiResponse.success(RoomJoinResponse.of(joined)));
    }

    /**
     * 离开房间。对局中离开视为认输；最后一人离开时房间销毁。
     */
    @PostMapping("/{code}/leave")
    public ResponseEntity<ApiResponse<LeaveResult>> leave(@PathVariable String code,
                                                          @RequestParam("playerId") String playerId) {
        Room room = registry.get(code);
        LeaveResult result = registry.leave(code, playerId);
        if (!result.roomDestroyed()) {
            broadcaster.sendState(room, dispatcher.stampedSnapshot(room));
        }
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    /**
     * 重开一局（仅房间成员）。当前阶段不能重开时返回 422 与现有快照。
     */
    @PostMapping("/{code}/restart")
    public ResponseEntity<ApiResponse<Object>> restart(@PathVariable String code,
                                                       @RequestParam("playerId") String playerId) {
        Room room = registry.get(code);
        DispatchResult r = dispatcher.restart(room, playerId);
        if (!r.accepted()) {
            return ResponseEntity.status(ApiResponse.REJECTED)
                    .body(ApiResponse.rejected(r.result().rejection().name(), r.result().message(), r.snapshot()));
        }
        broadcaster.sendState(room, r);
        return ResponseEntity.ok(ApiResponse.success(r.snapshot()));
    }

    /**
     * 房间全量只读视图：首屏渲染/断线重连时拉取。
     */
    @GetMapping("/{code}/view")
    public ResponseEntity<ApiResponse<RoomView>> view(@PathVariable String code) {
        Room room = registry.get(code);
        RoomView view = new RoomView(room.getCode(), room.getGameType().key(), room.getPlayers(),
                dispatcher.snapshot(room));
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    public record RoomJoinResponse(String roomCode, String gameType, String playerId, int playerCount) {

        static RoomJoinResponse of(JoinResult joined) {
            Room room = joined.room();
            return new RoomJoinResponse(room.getCode(), room.getGameType().key(), joined.playerId(), room.playerCount());
        }
    }

    public record RoomView(String roomCode, String gameType, List<String> players, Object snapshot) {
    }
}
