package com.roomhub.roomservice.games.blackjack.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.roomhub.roomservice.engine.cards.Card;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackPhase;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 21 点牌桌快照。
 * dealerCards 只含已翻开的牌，hiddenDealerCards 为暗牌张数；dealerValue 翻牌前为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlackjackSnapshot(
        String roomCode,
        BlackjackPhase phase,
        List<String> seats,
        String currentPlayerId,
        List<Card> dealerCards,
        int hiddenDealerCards,
        Integer dealerValue,
        List<PlayerView> players) {

    public BlackjackSnapshot {
        // 座位允许为空位（null），不能用 List.copyOf
        seats = Collections.unmodifiableList(new ArrayList<>(seats));
        dealerCards = List.copyOf(dealerCards);
        players = List.copyOf(players);
    }

    public record PlayerView(
            int seatIndex,
            String playerId,
            List<Card> hand,
            int handValue,
            boolean inRound,
            boolean stood,
            boolean bust,
            int chips,
            int bet,
            BlackjackResult result) {

        public PlayerView {
            hand = List.copyOf(hand);
        }
    }
}
