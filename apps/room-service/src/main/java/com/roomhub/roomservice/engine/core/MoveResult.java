package com.roomhub.roomservice.engine.core;

import java.util.Objects;

/**
 * 一次动作的结果：接受，或带原因的拒绝。
 * 用返回值而不是异常表达规则失败，调用方必须检查 accepted。
 */
public record MoveResult(boolean accepted, Rejection rejection) {

    private static final MoveResult OK = new MoveResult(true, null);

    public MoveResult {
        if (!accepted) Objects.requireNonNull(rejection, "rejection");
    }

    public static MoveResult ok() {
        return OK;
    }

    public static MoveResult rejected(Rejection reason) {
        return new MoveResult(false, reason);
    }

    /** 玩家可见的提示文本；接受时为 null */
    public String message() {
        return accepted ? null : rejection.message();
    }
}
