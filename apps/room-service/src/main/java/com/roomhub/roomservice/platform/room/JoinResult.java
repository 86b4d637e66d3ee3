package com.roomhub.roomservice.platform.room;

/** 创建/加入房间的结果：房间 + 分配到的玩家ID */
public record JoinResult(Room room, String playerId) {
}
