package com.roomhub.roomservice.games.blackjack.service;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.games.blackjack.domain.model.BlackjackRoomState;
import com.roomhub.roomservice.games.blackjack.domain.model.BlackjackSnapshot;
import com.roomhub.roomservice.platform.dispatch.BlackjackCommand;
import com.roomhub.roomservice.platform.dispatch.GameAction;
import com.roomhub.roomservice.platform.dispatch.GameHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 21 点接入：入座 = 上桌，离座 = 离桌；重开即开新一局。
 */
@Slf4j
@Component
public class BlackjackGameHandler implements GameHandler<BlackjackRoomState> {

    @Override
    public GameType gameType() {
        return GameType.BLACKJACK;
    }

    @Override
    public Class<BlackjackRoomState> stateType() {
        return BlackjackRoomState.class;
    }

    @Override
    public BlackjackRoomState createState(String roomCode) {
        return new BlackjackRoomState(roomCode);
    }

    @Override
    public void onPlayerJoined(BlackjackRoomState state, String playerId) {
        int seat = state.getOrAssignSeatForPlayer(playerId);
        state.engine().addPlayer(playerId);
        log.debug("21点入座: room={}, player={}, seat={}", state.roomCode(), playerId, seat);
    }

    @Override
    public void onPlayerLeft(BlackjackRoomState state, String playerId) {
        state.unseatPlayer(playerId);
        state.engine().removePlayer(playerId);
    }

    @Override
    public MoveResult restart(BlackjackRoomState state) {
        return state.engine().startRound();
    }

    @Override
    public MoveResult handle(BlackjackRoomState state, String playerId, GameAction action) {
        if (!(action instanceof BlackjackCommand cmd)) {
            return MoveResult.rejected(Rejection.UNSUPPORTED_ACTION);
        }
        return state.engine().apply(playerId, cmd.action());
    }

    @Override
    public BlackjackSnapshot snapshot(BlackjackRoomState state) {
        return state.snapshot();
    }
}
