package com.roomhub.roomservice.games.tictactoe.service;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.MoveResult;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.games.tictactoe.domain.model.TicTacToeRoomState;
import com.roomhub.roomservice.games.tictactoe.domain.model.TicTacToeSnapshot;
import com.roomhub.roomservice.platform.dispatch.GameAction;
import com.roomhub.roomservice.platform.dispatch.GameHandler;
import com.roomhub.roomservice.platform.dispatch.TicTacToeMove;
import org.springframework.stereotype.Component;

/**
 * 井字棋接入：房主执 X 且先手，第二名玩家执 O。
 */
@Component
public class TicTacToeGameHandler implements GameHandler<TicTacToeRoomState> {

    @Override
    public GameType gameType() {
        return GameType.TIC_TAC_TOE;
    }

    @Override
    public Class<TicTacToeRoomState> stateType() {
        return TicTacToeRoomState.class;
    }

    @Override
    public TicTacToeRoomState createState(String roomCode) {
        return new TicTacToeRoomState(roomCode);
    }

    @Override
    public void onPlayerJoined(TicTacToeRoomState state, String playerId) {
        state.seatPlayer(playerId);
    }

    @Override
    public void onPlayerLeft(TicTacToeRoomState state, String playerId) {
        state.unseatPlayer(playerId);
    }

    @Override
    public MoveResult restart(TicTacToeRoomState state) {
        state.reset();
        return MoveResult.ok();
    }

    @Override
    public MoveResult handle(TicTacToeRoomState state, String playerId, GameAction action) {
        if (!(action instanceof TicTacToeMove move)) {
            return MoveResult.rejected(Rejection.UNSUPPORTED_ACTION);
        }
        return state.tryMove(playerId, move.cellIndex());
    }

    @Override
    public TicTacToeSnapshot snapshot(TicTacToeRoomState state) {
        return state.snapshot();
    }
}
