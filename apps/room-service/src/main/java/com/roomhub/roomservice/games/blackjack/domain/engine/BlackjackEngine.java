package com.roomhub.roomservice.games.blackjack.domain.engine;

import com.roomhub.roomservice.engine.cards.Card;
import com.roomhub.roomservice.engine.cards.Deck;
import com.roomhub.roomservice.engine.cards.Rank;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackAction;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackPhase;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackResult;
import com.roomhub.roomservice.games.blackjack.domain.model.BlackjackPlayerState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * 21 点核心逻辑：1~4 名玩家对庄家，不含网络与展示。
 *
 * 流程：LOBBY → DEALING → PLAYER_TURNS → DEALER_TURN → ROUND_RESULTS → （再开一局）。
 * - 开局每人两张，按 "每个玩家一张、庄家一张" 发两轮，庄家第二张为暗牌；
 * - 玩家按入座顺序依次要牌/停牌，爆牌即结束本手；
 * - 所有玩家结束后庄家补牌到 17 点以上，然后结算，筹码按固定下注加减。
 */
public class BlackjackEngine {

    public static final int BLACKJACK = 21;
    public static final int DEALER_STANDS_ON = 17;
    private static final int INITIAL_CARDS = 2;

    private final Deck deck;
    private final List<BlackjackPlayerState> players = new ArrayList<>();
    private final List<Card> dealerHand = new ArrayList<>();

    private BlackjackPhase phase = BlackjackPhase.LOBBY;
    /** 当前行动玩家下标；PLAYER_TURNS 以外为 -1 */
    private int currentIndex = -1;

    public BlackjackEngine(Random rng) {
        this.deck = new Deck(rng);
    }

    // --------- 玩家 ----------

    /** 玩家上桌（幂等），本局进行中加入的玩家从下一局开始参与 */
    public void addPlayer(String playerId) {
        if (findPlayer(playerId).isPresent()) {
            return;
        }
        players.add(new BlackjackPlayerState(playerId));
    }

    /**
     * 玩家离桌。轮到他时交给下一位；桌上没人了回到 LOBBY。
     */
    public void removePlayer(String playerId) {
        int idx = indexOf(playerId);
        if (idx < 0) {
            return;
        }
        players.remove(idx);

        if (players.isEmpty()) {
            phase = BlackjackPhase.LOBBY;
            currentIndex = -1;
            dealerHand.clear();
            return;
        }
        if (phase != BlackjackPhase.PLAYER_TURNS) {
            return;
        }
        if (idx < currentIndex) {
            currentIndex--;
        } else if (idx == currentIndex) {
            advanceFrom(currentIndex - 1);
        }
    }

    // --------- 动作 ----------

    public MoveResult apply(String playerId, BlackjackAction action) {
        if (indexOf(playerId) < 0) {
            return MoveResult.rejected(Rejection.UNKNOWN_PLAYER);
        }
        return switch (action) {
            case START_ROUND -> startRound();
            case HIT, STAND -> act(playerId, action);
        };
    }

    /** 开新一局：洗牌、清手牌、发两轮牌，进入玩家回合 */
    public MoveResult startRound() {
        if (!phase.canStartRound()) {
            return MoveResult.rejected(Rejection.WRONG_PHASE);
        }
        if (players.isEmpty()) {
            return MoveResult.rejected(Rejection.NO_PLAYERS);
        }

        phase = BlackjackPhase.DEALING;
        deck.reset();
        dealerHand.clear();
        players.forEach(BlackjackPlayerState::resetForRound);

        for (int pass = 0; pass < INITIAL_CARDS; pass++) {
            for (BlackjackPlayerState p : players) {
                deck.tryDraw().ifPresent(p.getHand()::add);
            }
            deck.tryDraw().ifPresent(dealerHand::add);
        }

        phase = BlackjackPhase.PLAYER_TURNS;
        advanceFrom(-1);
        return MoveResult.ok();
    }

    private MoveResult act(String playerId, BlackjackAction action) {
        if (phase != BlackjackPhase.PLAYER_TURNS) {
            return MoveResult.rejected(Rejection.WRONG_PHASE);
        }
        int idx = indexOf(playerId);
        if (idx != currentIndex) {
            return MoveResult.rejected(Rejection.NOT_YOUR_TURN);
        }
        BlackjackPlayerState p = players.get(idx);
        if (!p.isActive()) {
            return MoveResult.rejected(Rejection.HAND_FINISHED);
        }

        if (action == BlackjackAction.HIT) {
            deck.tryDraw().ifPresent(p.getHand()::add);
            if (handValue(p.getHand()) > BLACKJACK) {
                p.setBust(true);
            }
        } else {
            p.setStood(true);
        }

        if (!p.isActive()) {
            advanceFrom(currentIndex);
        }
        return MoveResult.ok();
    }

    // --------- 读方法 ----------

    public BlackjackPhase phase() {
        return phase;
    }

    /** 当前行动玩家；非玩家回合返回 null */
    public String currentPlayerId() {
        if (phase != BlackjackPhase.PLAYER_TURNS || currentIndex < 0 || currentIndex >= players.size()) {
            return null;
        }
        return players.get(currentIndex).getPlayerId();
    }

    public List<BlackjackPlayerState> players() {
        return Collections.unmodifiableList(players);
    }

    public Optional<BlackjackPlayerState> findPlayer(String playerId) {
        return players.stream().filter(p -> p.getPlayerId().equals(playerId)).findFirst();
    }

    public List<Card> dealerHand() {
        return Collections.unmodifiableList(dealerHand);
    }

    public boolean dealerRevealed() {
        return phase.dealerRevealed();
    }

    public int deckCount() {
        return deck.count();
    }

    /**
     * 手牌点数：J/Q/K 记 10，A 先记 11，总数超过 21 时逐张改记 1。
     */
    public static int handValue(List<Card> hand) {
        int total = 0;
        int aces = 0;
        for (Card card : hand) {
            Rank rank = card.rank();
            if (rank == Rank.ACE) {
                aces++;
                total += 11;
            } else if (rank.isFace()) {
                total += 10;
            } else {
                total += rank.value();
            }
        }
        while (total > BLACKJACK && aces > 0) {
            total -= 10;
            aces--;
        }
        return total;
    }

    /** 两张牌正好 21 点 */
    public static boolean isNatural(List<Card> hand) {
        return hand.size() == INITIAL_CARDS && handValue(hand) == BLACKJACK;
    }

    // ----------- private helpers -----------

    /** 从 start 之后找下一位仍需行动的玩家；没有则进入庄家回合 */
    private void advanceFrom(int start) {
        for (int i = start + 1; i < players.size(); i++) {
            if (players.get(i).isActive()) {
                currentIndex = i;
                return;
            }
        }
        currentIndex = -1;
        playDealer();
    }

    private void playDealer() {
        phase = BlackjackPhase.DEALER_TURN;
        while (handValue(dealerHand) < DEALER_STANDS_ON) {
            Optional<Card> card = deck.tryDraw();
            if (card.isEmpty()) {
                break;
            }
            dealerHand.add(card.get());
        }
        settle();
        phase = BlackjackPhase.ROUND_RESULTS;
    }

    private void settle() {
        int dealerValue = handValue(dealerHand);
        boolean dealerBust = dealerValue > BLACKJACK;
        boolean dealerNatural = isNatural(dealerHand);

        for (BlackjackPlayerState p : players) {
            if (!p.isInRound()) {
                p.setResult(BlackjackResult.PENDING);
                continue;
            }
            int value = handValue(p.getHand());
            BlackjackResult result;
            if (p.isBust()) {
                result = BlackjackResult.LOSE;
            } else if (isNatural(p.getHand())) {
                result = dealerNatural ? BlackjackResult.PUSH : BlackjackResult.BLACKJACK;
            } else if (dealerBust || value > dealerValue) {
                result = BlackjackResult.WIN;
            } else if (value < dealerValue) {
                result = BlackjackResult.LOSE;
            } else {
                result = BlackjackResult.PUSH;
            }
            p.setResult(result);
            switch (result) {
                case WIN, BLACKJACK -> p.setChips(p.getChips() + p.getBet());
                case LOSE -> p.setChips(p.getChips() - p.getBet());
            }
        }
    }

    private int indexOf(String playerId) {
        if (playerId == null) return -1;
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getPlayerId().equals(playerId)) return i;
        }
        return -1;
    }
}
