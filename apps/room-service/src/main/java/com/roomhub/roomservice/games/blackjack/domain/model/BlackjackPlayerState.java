package com.roomhub.roomservice.games.blackjack.domain.model;

import com.roomhub.roomservice.engine.cards.Card;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackResult;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 牌桌上一名玩家的状态。筹码跨局累计，其余字段每局重置。
 */
@Data
public class BlackjackPlayerState {

    /** 默认下注（固定 1） */
    public static final int DEFAULT_BET = 1;

    private final String playerId;
    private final List<Card> hand = new ArrayList<>();

    private boolean inRound;
    private boolean stood;
    private boolean bust;
    private int chips;
    private int bet = DEFAULT_BET;
    private BlackjackResult result = BlackjackResult.PENDING;

    /** 仍在等待行动：本局参与且未爆牌、未停牌 */
    public boolean isActive() {
        return inRound && !bust && !stood;
    }

    public void resetForRound() {
        hand.clear();
        inRound = true;
        stood = false;
        bust = false;
        bet = DEFAULT_BET;
        result = BlackjackResult.PENDING;
    }
}
