package com.roomhub.roomservice.engine.core;

import java.util.Objects;
import java.util.Random;

/**
 * 决定开局先手。
 * 井字棋默认主方（房主，X）先走；跳棋默认随机。
 */
@FunctionalInterface
public interface FirstTurnPolicy {

    /**
     * @param primaryPlayerId   主方玩家（井字棋 X / 跳棋红方）
     * @param secondaryPlayerId 另一方玩家
     * @return 先手玩家ID，必须是两者之一
     */
    String choose(String primaryPlayerId, String secondaryPlayerId);

    static FirstTurnPolicy primaryFirst() {
        return (primary, secondary) -> primary;
    }

    static FirstTurnPolicy secondaryFirst() {
        return (primary, secondary) -> secondary;
    }

    static FirstTurnPolicy random(Random rng) {
        Objects.requireNonNull(rng, "rng");
        return (primary, secondary) -> rng.nextBoolean() ? primary : secondary;
    }
}
