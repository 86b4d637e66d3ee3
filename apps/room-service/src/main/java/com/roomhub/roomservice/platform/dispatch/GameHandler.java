package com.roomhub.roomservice.platform.dispatch;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.RoomState;

/**
 * 单个游戏接入房间平台的适配器。
 * 平台只通过这里驱动游戏：建状态、玩家进出、重开、处理动作、出快照。
 * 调用方保证同一房间的调用已经在房间锁内串行执行。
 *
 * @param <S> 该游戏的房间状态类型
 */
public interface GameHandler<S extends RoomState> {

    GameType gameType();

    Class<S> stateType();

    S createState(String roomCode);

    void onPlayerJoined(S state, String playerId);

    void onPlayerLeft(S state, String playerId);

    /** 重开一局；某些游戏在当前阶段不能重开时返回拒绝 */
    MoveResult restart(S state);

    MoveResult handle(S state, String playerId, GameAction action);

    /** 只读快照，广播/HTTP 查询都用它 */
    Object snapshot(S state);
}
