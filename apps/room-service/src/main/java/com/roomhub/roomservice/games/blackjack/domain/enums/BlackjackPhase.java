package com.roomhub.roomservice.games.blackjack.domain.enums;

public enum BlackjackPhase {

    LOBBY,          // 等人，可以开局
    DEALING,        // 发初始两张
    PLAYER_TURNS,   // 玩家依次要牌/停牌
    DEALER_TURN,    // 庄家补牌到 17
    ROUND_RESULTS;  // 结算完成，可以再开一局

    /** 庄家暗牌是否已翻开 */
    public boolean dealerRevealed() {
        return this == DEALER_TURN || this == ROUND_RESULTS;
    }

    /** 可以开新一局的阶段 */
    public boolean canStartRound() {
        return this == LOBBY || this == ROUND_RESULTS;
    }
}
