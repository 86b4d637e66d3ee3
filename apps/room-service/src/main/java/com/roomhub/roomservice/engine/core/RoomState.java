package com.roomhub.roomservice.engine.core;

/**
 * 房间内单局游戏状态的最小能力接口。
 * - 每个具体游戏（井字棋/跳棋/21点）的房间状态都实现它；
 * - 通用的调度器只依赖 roomCode + gameType，就能把不同游戏的状态放进同一个集合，
 *   按房间号路由动作，不需要对游戏种类做 switch；
 * - 房间号唯一性由房间注册表保证，不由状态对象自己保证。
 */
public interface RoomState {

    /** 房间号：非空、在房间生命周期内不变 */
    String roomCode();

    /** 变体标签：只在需要游戏专属操作时才用来匹配 */
    GameType gameType();
}
