package com.roomhub.roomservice.platform.dispatch;

import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackAction;

import java.util.Objects;

/** 21 点牌桌指令 */
public record BlackjackCommand(BlackjackAction action) implements GameAction {

    public BlackjackCommand {
        Objects.requireNonNull(action, "action");
    }
}
