package com.roomhub.roomservice.platform.dispatch;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.engine.core.Rejection;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackAction;
import com.roomhub.roomservice.games.blackjack.domain.enums.BlackjackPhase;
import com.roomhub.roomservice.games.blackjack.domain.model.BlackjackSnapshot;
import com.roomhub.roomservice.games.blackjack.service.BlackjackGameHandler;
import com.roomhub.roomservice.games.checkers.service.CheckersGameHandler;
import com.roomhub.roomservice.games.tictactoe.domain.enums.Mark;
import com.roomhub.roomservice.games.tictactoe.domain.model.TicTacToeSnapshot;
import com.roomhub.roomservice.games.tictactoe.service.TicTacToeGameHandler;
import com.roomhub.roomservice.platform.room.Room;
import com.roomhub.roomservice.platform.room.RoomNotFoundException;
import com.roomhub.roomservice.platform.room.RoomProperties;
import com.roomhub.roomservice.platform.room.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameDispatcherTest {

    private GameDispatcher dispatcher;
    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        dispatcher = new GameDispatcher(List.of(
                new TicTacToeGameHandler(), new CheckersGameHandler(), new BlackjackGameHandler()));
        registry = new RoomRegistry(dispatcher, new RoomProperties());
    }

    private Room ticTacToeWithTwo() {
        Room room = registry.create(GameType.TIC_TAC_TOE).room();
        registry.join(room.getCode());
        return room;
    }

    @Test
    void duplicateHandlersAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> new GameDispatcher(List.of(new TicTacToeGameHandler(), new TicTacToeGameHandler())));
    }

    @Test
    void unregisteredGameCannotBeCreated() {
        GameDispatcher onlyTicTacToe = new GameDispatcher(List.of(new TicTacToeGameHandler()));
        assertFalse(onlyTicTacToe.supports(GameType.CHECKERS));
        assertThrows(IllegalArgumentException.class, () -> onlyTicTacToe.createState(GameType.CHECKERS, "ABCD"));
    }

    @Test
    void acceptedMoveReturnsUpdatedSnapshot() {
        Room room = ticTacToeWithTwo();
        DispatchResult r = dispatcher.dispatch(room, "P1", new TicTacToeMove(4));

        assertTrue(r.accepted());
        TicTacToeSnapshot snap = (TicTacToeSnapshot) r.snapshot();
        assertEquals(Mark.X, snap.cells().get(4));
        assertEquals("P2", snap.currentPlayerId());
    }

    @Test
    void rejectedMoveKeepsSnapshot() {
        Room room = ticTacToeWithTwo();
        Object before = dispatcher.snapshot(room);
        DispatchResult r = dispatcher.dispatch(room, "P2", new TicTacToeMove(4));

        assertFalse(r.accepted());
        assertEquals(Rejection.NOT_YOUR_TURN, r.result().rejection());
        assertEquals(before, r.snapshot());
    }

    @Test
    void actionOfAnotherGameIsUnsupported() {
        Room room = ticTacToeWithTwo();
        DispatchResult r = dispatcher.dispatch(room, "P1", new CheckersMove(5, 0, 4, 1));
        assertEquals(Rejection.UNSUPPORTED_ACTION, r.result().rejection());

        Room blackjack = registry.create(GameType.BLACKJACK).room();
        assertEquals(Rejection.UNSUPPORTED_ACTION,
                dispatcher.dispatch(blackjack, "P1", new TicTacToeMove(0)).result().rejection());
    }

    @Test
    void strangersCannotAct() {
        Room room = ticTacToeWithTwo();
        assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(room, "P3", new TicTacToeMove(0)));
        assertThrows(IllegalStateException.class, () -> dispatcher.restart(room, "P3"));
    }

    @Test
    void blackjackRestartStartsRoundOnlyBetweenRounds() {
        Room room = registry.create(GameType.BLACKJACK).room();

        DispatchResult first = dispatcher.restart(room, "P1");
        assertTrue(first.accepted());
        assertEquals(BlackjackPhase.PLAYER_TURNS, ((BlackjackSnapshot) first.snapshot()).phase());

        DispatchResult second = dispatcher.restart(room, "P1");
        assertEquals(Rejection.WRONG_PHASE, second.result().rejection());

        assertTrue(dispatcher.dispatch(room, "P1", new BlackjackCommand(BlackjackAction.STAND)).accepted());
        assertEquals(BlackjackPhase.ROUND_RESULTS, ((BlackjackSnapshot) dispatcher.snapshot(room)).phase());
    }

    @Test
    void dispatchTouchesRoom() throws InterruptedException {
        Room room = ticTacToeWithTwo();
        var before = room.getLastActiveAt();
        Thread.sleep(5);
        dispatcher.dispatch(room, "P1", new TicTacToeMove(0));
        assertTrue(room.getLastActiveAt().isAfter(before));
    }

    @Test
    void seqIsAssignedWithSnapshotAndKeepsIncreasing() {
        Room room = ticTacToeWithTwo();

        DispatchResult first = dispatcher.dispatch(room, "P1", new TicTacToeMove(0));
        DispatchResult rejected = dispatcher.dispatch(room, "P1", new TicTacToeMove(1));
        DispatchResult second = dispatcher.dispatch(room, "P2", new TicTacToeMove(1));
        DispatchResult stamped = dispatcher.stampedSnapshot(room);

        assertEquals(1, first.seq());
        assertEquals(2, rejected.seq());
        assertEquals(3, second.seq());
        assertEquals(4, stamped.seq());
        assertEquals(1, ((TicTacToeSnapshot) first.snapshot()).moveCount());
        assertEquals(2, ((TicTacToeSnapshot) stamped.snapshot()).moveCount());
    }

    @Test
    void destroyedRoomRejectsActions() {
        Room room = ticTacToeWithTwo();
        registry.leave(room.getCode(), "P2");
        registry.leave(room.getCode(), "P1");

        assertTrue(room.isClosed());
        assertThrows(RoomNotFoundException.class, () -> dispatcher.dispatch(room, "P1", new TicTacToeMove(0)));
        assertThrows(RoomNotFoundException.class, () -> dispatcher.restart(room, "P1"));
    }
}
