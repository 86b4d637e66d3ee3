package com.roomhub.roomservice.platform.dispatch;

/**
 * 玩家对房间发起的一个游戏动作（走子、要牌等）。
 * 每种游戏只认自己的动作类型，收到别的类型一律按 UNSUPPORTED_ACTION 拒绝。
 */
public interface GameAction {
}
