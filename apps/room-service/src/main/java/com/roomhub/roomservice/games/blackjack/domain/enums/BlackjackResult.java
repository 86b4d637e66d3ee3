package com.roomhub.roomservice.games.blackjack.domain.enums;

/** 单个玩家本局结果 */
public enum BlackjackResult {
    PENDING,
    WIN,
    LOSE,
    PUSH,
    BLACKJACK
}
