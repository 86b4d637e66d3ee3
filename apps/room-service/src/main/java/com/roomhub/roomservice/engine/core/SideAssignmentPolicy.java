package com.roomhub.roomservice.engine.core;

import java.util.Objects;
import java.util.Random;

/**
 * 开局时把两名玩家分配到两方（跳棋：红/黑）。
 * 作为可替换的策略注入，测试可以换成确定性的实现。
 */
@FunctionalInterface
public interface SideAssignmentPolicy {

    /**
     * @param first  先加入的玩家
     * @param second 后加入的玩家
     * @return true 表示 first 执主方（跳棋红方），false 表示 second 执主方
     */
    boolean firstTakesPrimary(String first, String second);

    /** 随机分边（跳棋默认，公平性要求） */
    static SideAssignmentPolicy random(Random rng) {
        Objects.requireNonNull(rng, "rng");
        return (first, second) -> rng.nextBoolean();
    }

    /** 先到先得：先加入者执主方 */
    static SideAssignmentPolicy joinOrder() {
        return (first, second) -> true;
    }
}
