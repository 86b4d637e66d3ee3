package com.roomhub.roomservice.platform.dispatch;

import com.roomhub.roomservice.engine.core.MoveResult;

/**
 * 一次调度的结果：规则层结论 + 处理后的快照（拒绝时快照等于处理前）。
 * seq 与快照在同一次持锁内分配，广播时直接使用。
 */
public record DispatchResult(MoveResult result, Object snapshot, long seq) {

    public boolean accepted() {
        return result.accepted();
    }
}
