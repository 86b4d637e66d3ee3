package com.roomhub.roomservice.platform.room;

import java.util.List;

/**
 * 离开房间的结果。
 *
 * @param roomDestroyed    最后一人离开，房间已销毁
 * @param remainingPlayers 仍在房间的玩家
 */
public record LeaveResult(boolean roomDestroyed, List<String> remainingPlayers) {

    public LeaveResult {
        remainingPlayers = List.copyOf(remainingPlayers);
    }
}
