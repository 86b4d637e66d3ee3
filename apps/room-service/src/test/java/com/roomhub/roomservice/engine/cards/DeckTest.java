package com.roomhub.roomservice.engine.cards;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeckTest {

    @Test
    void freshDeckHoldsEveryCardOnce() {
        Deck deck = new Deck(new Random(1));
        assertEquals(Deck.FULL_SIZE, deck.count());

        Set<Card> distinct = new HashSet<>(deck.remaining());
        assertEquals(52, distinct.size());
        for (Suit s : Suit.values()) {
            for (Rank r : Rank.values()) {
                assertTrue(distinct.contains(new Card(s, r)), "missing " + r + s);
            }
        }
    }

    @Test
    void drawsFiftyTwoThenReportsEmpty() {
        Deck deck = new Deck(new Random(2));
        for (int i = 0; i < 52; i++) {
            assertTrue(deck.tryDraw().isPresent());
        }
        assertTrue(deck.isEmpty());
        assertEquals(Optional.empty(), deck.tryDraw());
    }

    @Test
    void drawTakesFromTheTop() {
        Deck deck = new Deck(new Random(3));
        List<Card> before = deck.remaining();
        Card top = before.get(before.size() - 1);
        assertEquals(top, deck.tryDraw().orElseThrow());
        assertEquals(51, deck.count());
    }

    @Test
    void drawManyStopsWhenStockRunsOut() {
        Deck deck = new Deck(new Random(4));
        assertEquals(52, deck.drawMany(60).size());
        assertTrue(deck.drawMany(5).isEmpty());
    }

    @Test
    void drawManyWithNonPositiveCountIsEmpty() {
        Deck deck = new Deck(new Random(5));
        assertTrue(deck.drawMany(0).isEmpty());
        assertTrue(deck.drawMany(-3).isEmpty());
        assertEquals(52, deck.count());
    }

    @Test
    void sameSeedSameOrder() {
        assertEquals(new Deck(new Random(42)).remaining(), new Deck(new Random(42)).remaining());
    }

    @Test
    void resetRestoresFullDeck() {
        Deck deck = new Deck(new Random(6));
        deck.drawMany(20);
        deck.reset();
        assertEquals(52, deck.count());
        assertEquals(52, new HashSet<>(deck.remaining()).size());
    }

    @Test
    void remainingIsReadOnly() {
        Deck deck = new Deck(new Random(7));
        assertThrows(UnsupportedOperationException.class, () -> deck.remaining().clear());
    }

    @Test
    void cardRendersRankAndSuit() {
        assertEquals("A♠", new Card(Suit.SPADES, Rank.ACE).toString());
        assertEquals("10♥", new Card(Suit.HEARTS, Rank.TEN).toString());
    }

    /** 标准顺序：梅花 2..A，方块，红桃，黑桃 */
    private static List<Card> canonical() {
        List<Card> cards = new ArrayList<>();
        for (Suit s : Suit.values()) {
            for (Rank r : Rank.values()) {
                cards.add(new Card(s, r));
            }
        }
        return cards;
    }

    @Test
    void shuffleWalksFromTheEndWithShrinkingBounds() {
        ScriptedRandom rng = new ScriptedRandom(bound -> 0);
        Deck deck = new Deck(rng);

        List<Integer> expectedBounds = new ArrayList<>();
        for (int bound = 52; bound >= 2; bound--) expectedBounds.add(bound);
        assertEquals(expectedBounds, rng.bounds());

        // 每次都与下标 0 交换：整体左移一位，2♣ 落到牌顶
        List<Card> expected = canonical();
        expected.add(expected.remove(0));
        assertEquals(expected, deck.remaining());
        assertEquals(new Card(Suit.CLUBS, Rank.TWO), deck.tryDraw().orElseThrow());
    }

    @Test
    void shuffleSwapsExactlyThePickedPositions() {
        Deck deck = new Deck(new ScriptedRandom(bound -> bound / 2));
        List<Card> cards = deck.remaining();

        assertEquals(new Card(Suit.CLUBS, Rank.TWO), cards.get(0));
        assertEquals(new Card(Suit.HEARTS, Rank.NINE), cards.get(1));
        assertEquals(new Card(Suit.CLUBS, Rank.THREE), cards.get(2));
        assertEquals(new Card(Suit.SPADES, Rank.QUEEN), cards.get(3));
        assertEquals(new Card(Suit.DIAMONDS, Rank.ACE), cards.get(50));
        assertEquals(new Card(Suit.HEARTS, Rank.TWO), cards.get(51));
    }

    @Test
    void pickingTheLastIndexKeepsCanonicalOrder() {
        assertEquals(canonical(), new Deck(ScriptedRandom.unshuffled()).remaining());
    }
}
