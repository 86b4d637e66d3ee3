package com.roomhub.roomservice.engine.cards;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * 标准 52 张牌的牌堆。
 * - 每个房间/每局各自持有，不做全局共享；
 * - 随机源在构造时注入，同一种子得到同一顺序（测试可复现）；
 * - 列表末尾视为“牌顶”，发牌从末尾取。
 */
public final class Deck {

    /** 一副完整牌的张数 */
    public static final int FULL_SIZE = 52;

    private final List<Card> cards = new ArrayList<>(FULL_SIZE);
    private final Random rng;

    public Deck() {
        this(new Random());
    }

    public Deck(Random rng) {
        this.rng = Objects.requireNonNull(rng, "rng");
        reset();
    }

    /** 剩余张数 */
    public int count() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /** 清空并按 花色-点数 的标准顺序重建 52 张，然后洗牌 */
    public void reset() {
        cards.clear();
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(suit, rank));
            }
        }
        shuffle();
    }

    /**
     * Fisher-Yates 原地洗牌：i 从末尾到 1，与 [0, i] 中均匀选出的 j 交换。
     * 种子固定时结果固定，不能换成其它洗牌算法。
     */
    public void shuffle() {
        for (int i = cards.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            Collections.swap(cards, i, j);
        }
    }

    /** 从牌顶摸一张；牌堆为空时返回 empty，不抛异常 */
    public Optional<Card> tryDraw() {
        if (cards.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(cards.remove(cards.size() - 1));
    }

    /** 逐张摸最多 count 张；牌不够时提前停止，返回的张数可能少于 count */
    public List<Card> drawMany(int count) {
        List<Card> result = new ArrayList<>(Math.max(count, 0));
        for (int i = 0; i < count && !cards.isEmpty(); i++) {
            result.add(cards.remove(cards.size() - 1));
        }
        return result;
    }

    /** 剩余牌的只读视图（顺序即牌堆顺序，末尾为牌顶） */
    public List<Card> remaining() {
        return Collections.unmodifiableList(new ArrayList<>(cards));
    }
}
