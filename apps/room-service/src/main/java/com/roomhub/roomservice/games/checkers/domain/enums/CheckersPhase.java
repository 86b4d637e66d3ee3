package com.roomhub.roomservice.games.checkers.domain.enums;

public enum CheckersPhase {

    NOT_STARTED,  // 等待第二名玩家
    ACTIVE,       // 对局中
    GAME_OVER     // 已结束（可重开）
}
