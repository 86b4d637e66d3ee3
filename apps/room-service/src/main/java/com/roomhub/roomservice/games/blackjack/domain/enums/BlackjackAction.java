package com.roomhub.roomservice.games.blackjack.domain.enums;

/** 牌桌动作：开局、要牌、停牌 */
public enum BlackjackAction {
    START_ROUND,
    HIT,
    STAND
}
