package com.roomhub.roomservice.games.blackjack.domain.model;

import com.roomhub.roomservice.engine.cards.Card;
import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.RoomState;
import com.roomhub.roomservice.games.blackjack.domain.engine.BlackjackEngine;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackPhase;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;

/**
 * 21 点房间状态：4 个座位 + 牌桌引擎。
 * 座位只是房间层的映射（座位号 → 玩家ID），牌局规则全部在 {@link BlackjackEngine}。
 */
public class BlackjackRoomState implements RoomState {

    public static final int SEAT_COUNT = 4;

    private final String roomCode;
    private final BlackjackEngine engine;
    private final String[] seatPlayerIds = new String[SEAT_COUNT];

    public BlackjackRoomState(String roomCode) {
        this(roomCode, new SecureRandom());
    }

    public BlackjackRoomState(String roomCode, Random rng) {
        if (StringUtils.isBlank(roomCode)) {
            throw new IllegalArgumentException("Room code cannot be null or empty.");
        }
        this.roomCode = roomCode;
        this.engine = new BlackjackEngine(rng);
    }

    @Override
    public String roomCode() {
        return roomCode;
    }

    @Override
    public GameType gameType() {
        return GameType.BLACKJACK;
    }

    public BlackjackEngine engine() {
        return engine;
    }

    /**
     * 取座位（幂等）：已入座返回原座位；否则占第一个空座。
     * 4 个座位都满时返回 0 且不占座，人数上限由房间注册表保证。
     */
    public int getOrAssignSeatForPlayer(String playerId) {
        OptionalInt existing = tryGetSeatIndex(playerId);
        if (existing.isPresent()) {
            return existing.getAsInt();
        }
        for (int i = 0; i < SEAT_COUNT; i++) {
            if (seatPlayerIds[i] == null) {
                seatPlayerIds[i] = playerId;
                return i;
            }
        }
        return 0;
    }

    /** 清掉该玩家占的所有座位 */
    public void unseatPlayer(String playerId) {
        for (int i = 0; i < SEAT_COUNT; i++) {
            if (seatPlayerIds[i] != null && seatPlayerIds[i].equals(playerId)) {
                seatPlayerIds[i] = null;
            }
        }
    }

    public OptionalInt tryGetSeatIndex(String playerId) {
        if (playerId == null) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < SEAT_COUNT; i++) {
            if (playerId.equals(seatPlayerIds[i])) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public int seatedCount() {
        int n = 0;
        for (String id : seatPlayerIds) {
            if (StringUtils.isNotEmpty(id)) n++;
        }
        return n;
    }

    public String seatPlayerId(int seat) {
        return seatPlayerIds[seat];
    }

    public List<String> seats() {
        return Arrays.asList(seatPlayerIds.clone());
    }

    /** 引擎离开 LOBBY 即视为已开局 */
    public boolean gameStarted() {
        return engine.phase() != BlackjackPhase.LOBBY;
    }

    /** 生成快照；庄家暗牌在翻开前不下发 */
    public BlackjackSnapshot snapshot() {
        List<BlackjackSnapshot.PlayerView> views = new ArrayList<>();
        for (BlackjackPlayerState p : engine.players()) {
            views.add(new BlackjackSnapshot.PlayerView(
                    tryGetSeatIndex(p.getPlayerId()).orElse(-1),
                    p.getPlayerId(),
                    p.getHand(),
                    BlackjackEngine.handValue(p.getHand()),
                    p.isInRound(),
                    p.isStood(),
                    p.isBust(),
                    p.getChips(),
                    p.getBet(),
                    p.getResult()));
        }

        List<Card> dealer = engine.dealerHand();
        boolean revealed = engine.dealerRevealed();
        List<Card> visible = revealed || dealer.isEmpty() ? dealer : dealer.subList(0, 1);
        return new BlackjackSnapshot(
                roomCode,
                engine.phase(),
                seats(),
                engine.currentPlayerId(),
                visible,
                dealer.size() - visible.size(),
                revealed ? BlackjackEngine.handValue(dealer) : null,
                views);
    }
}
