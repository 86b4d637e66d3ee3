package com.roomhub.roomservice.games.checkers.service;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.games.checkers.domain.model.CheckersRoomState;
import com.roomhub.roomservice.games.checkers.domain.model.CheckersSnapshot;
import com.roomhub.roomservice.platform.dispatch.CheckersMove;
import com.roomhub.roomservice.platform.dispatch.GameAction;
import com.roomhub.roomservice.platform.dispatch.GameHandler;
import org.springframework.stereotype.Component;

/**
 * 跳棋接入：第二名玩家加入即开局，随机分边、随机先手。
 */
@Component
public class CheckersGameHandler implements GameHandler<CheckersRoomState> {

    @Override
    public GameType gameType() {
        return GameType.CHECKERS;
    }

    @Override
    public Class<CheckersRoomState> stateType() {
        return CheckersRoomState.class;
    }

    @Override
    public CheckersRoomState createState(String roomCode) {
        return new CheckersRoomState(roomCode);
    }

    @Override
    public void onPlayerJoined(CheckersRoomState state, String playerId) {
        state.join(playerId);
    }

    @Override
    public void onPlayerLeft(CheckersRoomState state, String playerId) {
        state.leave(playerId);
    }

    @Override
    public MoveResult restart(CheckersRoomState state) {
        state.restart();
        return MoveResult.ok();
    }

    @Override
    public MoveResult handle(CheckersRoomState state, String playerId, GameAction action) {
        if (!(action instanceof CheckersMove move)) {
            return MoveResult.rejected(Rejection.UNSUPPORTED_ACTION);
        }
        return state.tryMove(playerId, move.from(), move.to());
    }

    @Override
    public CheckersSnapshot snapshot(CheckersRoomState state) {
        return state.snapshot();
    }
}
