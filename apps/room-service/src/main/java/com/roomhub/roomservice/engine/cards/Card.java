package com.roomhub.roomservice.engine.cards;

import java.util.Objects;

/**
 * 一张扑克牌：花色 + 点数。
 * 值对象，花色点数相同即相等，没有归属语义。
 */
public record Card(Suit suit, Rank rank) {

    public Card {
        Objects.requireNonNull(suit, "suit");
        Objects.requireNonNull(rank, "rank");
    }

    /** 例如 "A♠"、"10♥"、"J♦" */
    @Override
    public String toString() {
        return rank.label() + suit.symbol();
    }
}
