package com.roomhub.roomservice.engine.core;

/**
 * 动作被规则层拒绝的原因。
 * 拒绝不是异常：状态保持不变，由调度器翻译成玩家可见的提示。
 */
public enum Rejection {

    // ---- 通用 ----
    GAME_NOT_STARTED("游戏尚未开始"),
    GAME_OVER("对局已结束"),
    NOT_YOUR_TURN("还没轮到你"),
    UNKNOWN_PLAYER("你不是本局玩家"),
    UNSUPPORTED_ACTION("该房间不支持此动作"),

    // ---- 棋盘类 ----
    OUT_OF_BOUNDS("坐标超出棋盘"),
    CELL_OCCUPIED("该位置已有棋子"),
    SAME_SQUARE("起点与终点相同"),
    NO_PIECE("起点没有棋子"),
    NOT_YOUR_PIECE("只能移动己方棋子"),
    MUST_CONTINUE_CAPTURE("必须用同一枚棋子继续吃子"),
    NOT_DIAGONAL("只能斜向移动"),
    BAD_DISTANCE("只能走一格或跳吃两格"),
    MEN_MOVE_FORWARD("普通棋子只能向前"),
    CAPTURE_REQUIRED("有子可吃时必须吃子"),
    NOTHING_TO_CAPTURE("跳过的位置没有棋子"),
    CANNOT_CAPTURE_OWN("不能吃己方棋子"),

    // ---- 牌桌类 ----
    WRONG_PHASE("当前阶段不能执行该动作"),
    NO_PLAYERS("桌上没有玩家"),
    HAND_FINISHED("本手牌已结束");

    private final String message;

    Rejection(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
