package com.roomhub.roomservice.platform.room;

import com.roomhub.roomservice.engine.core.GameType;
import com.roomhub.roomservice.games.blackjack.service.BlackjackGameHandler;
import com.roomhub.roomservice.games.checkers.domain.enums.CheckersPhase;
import com.roomhub.roomservice.games.checkers.domain.model.CheckersRoomState;
import com.roomhub.roomservice.games.checkers.service.CheckersGameHandler;
import com.roomhub.roomservice.games.tictactoe.domain.model.TicTacToeRoomState;
import com.roomhub.roomservice.games.tictactoe.service.TicTacToeGameHandler;
import com.roomhub.roomservice.platform.dispatch.GameDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoomRegistryTest {

    private RoomProperties properties;
    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new RoomProperties();
        GameDispatcher dispatcher = new GameDispatcher(List.of(
                new TicTacToeGameHandler(), new CheckersGameHandler(), new BlackjackGameHandler()));
        registry = new RoomRegistry(dispatcher, properties);
    }

    @Test
    void createJoinsCreatorAsFirstPlayer() {
        JoinResult created = registry.create(GameType.TIC_TAC_TOE);
        Room room = created.room();

        assertEquals("P1", created.playerId());
        assertEquals(4, room.getCode().length());
        for (char ch : room.getCode().toCharArray()) {
            assertTrue(RoomRegistry.CODE_ALPHABET.indexOf(ch) >= 0, "unexpected char " + ch);
        }
        TicTacToeRoomState state = (TicTacToeRoomState) room.getState();
        assertEquals("P1", state.getPlayerXId());
        assertEquals(room.getCode(), state.roomCode());
    }

    @Test
    void codeLengthIsConfigurable() {
        properties.setCodeLength(6);
        assertEquals(6, registry.create(GameType.BLACKJACK).room().getCode().length());
    }

    @Test
    void joinHandsOutNextSlotUntilFull() {
        String code = registry.create(GameType.TIC_TAC_TOE).room().getCode();
        assertEquals("P2", registry.join(code).playerId());
        assertThrows(IllegalStateException.class, () -> registry.join(code));
        assertEquals(2, registry.get(code).playerCount());
    }

    @Test
    void blackjackSeatsFour() {
        String code = registry.create(GameType.BLACKJACK).room().getCode();
        registry.join(code);
        registry.join(code);
        assertEquals("P4", registry.join(code).playerId());
        assertThrows(IllegalStateException.class, () -> registry.join(code));
    }

    @Test
    void secondCheckersPlayerStartsGame() {
        Room room = registry.create(GameType.CHECKERS).room();
        registry.join(room.getCode());
        assertEquals(CheckersPhase.ACTIVE, ((CheckersRoomState) room.getState()).phase());
    }

    @Test
    void lookupIsCaseInsensitiveAndMissingRoomThrows() {
        String code = registry.create(GameType.TIC_TAC_TOE).room().getCode();
        assertTrue(registry.find(code.toLowerCase()).isPresent());
        assertTrue(registry.find(null).isEmpty());
        assertThrows(RoomNotFoundException.class, () -> registry.get("ZZZZZZZZ"));
        assertThrows(RoomNotFoundException.class, () -> registry.join("ZZZZZZZZ"));
    }

    @Test
    void leaveFreesSlotAndLastLeaveDestroysRoom() {
        String code = registry.create(GameType.TIC_TAC_TOE).room().getCode();
        registry.join(code);

        LeaveResult first = registry.leave(code, "P1");
        assertFalse(first.roomDestroyed());
        assertEquals(List.of("P2"), first.remainingPlayers());
        assertEquals("P1", registry.join(code).playerId());

        registry.leave(code, "P1");
        LeaveResult last = registry.leave(code, "P2");
        assertTrue(last.roomDestroyed());
        assertTrue(last.remainingPlayers().isEmpty());
        assertTrue(registry.find(code).isEmpty());
    }

    @Test
    void leaveByStrangerIsConflict() {
        String code = registry.create(GameType.TIC_TAC_TOE).room().getCode();
        assertThrows(IllegalStateException.class, () -> registry.leave(code, "P7"));
    }

    @Test
    void leavingTicTacToeMidGameForfeits() {
        Room room = registry.create(GameType.TIC_TAC_TOE).room();
        registry.join(room.getCode());
        registry.leave(room.getCode(), "P2");

        TicTacToeRoomState state = (TicTacToeRoomState) room.getState();
        assertTrue(state.isGameOver());
        assertEquals("P1", state.getWinnerPlayerId());
    }

    @Test
    void withRoomRunsUnderLock() {
        String code = registry.create(GameType.TIC_TAC_TOE).room().getCode();
        assertEquals(1, registry.withRoom(code, Room::playerCount));
    }

    @Test
    void sweepRemovesOnlyIdleRooms() {
        properties.setIdleTtl(Duration.ofMinutes(10));
        registry.create(GameType.TIC_TAC_TOE);
        registry.create(GameType.CHECKERS);

        assertEquals(0, registry.sweepIdle(Instant.now()));
        assertEquals(2, registry.size());
        assertEquals(2, registry.sweepIdle(Instant.now().plus(Duration.ofMinutes(11))));
        assertEquals(0, registry.size());
    }

    @Test
    void joinWaitingOnLockFailsOnceLastPlayerLeaves() throws Exception {
        Room room = registry.create(GameType.TIC_TAC_TOE).room();
        String code = room.getCode();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<JoinResult> pending = room.withLock(() -> {
                Future<JoinResult> f = executor.submit(() -> registry.join(code));
                awaitQueued(room);
                assertTrue(registry.leave(code, "P1").roomDestroyed());
                return f;
            });

            ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertInstanceOf(RoomNotFoundException.class, e.getCause());
            assertTrue(room.getPlayers().isEmpty());
            assertTrue(registry.find(code).isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void sweptRoomCannotBeJoinedOrLeft() {
        properties.setIdleTtl(Duration.ofMinutes(10));
        Room room = registry.create(GameType.CHECKERS).room();
        String code = room.getCode();

        assertEquals(1, registry.sweepIdle(Instant.now().plus(Duration.ofMinutes(11))));
        assertTrue(room.isClosed());
        assertThrows(RoomNotFoundException.class, () -> registry.join(code));
        assertThrows(RoomNotFoundException.class, () -> registry.leave(code, "P1"));
    }

    /** 等另一个线程阻塞在房间锁上 */
    private static void awaitQueued(Room room) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!room.hasQueuedThreads()) {
            if (System.nanoTime() > deadline) {
                fail("join never reached the room lock");
            }
            Thread.onSpinWait();
        }
    }
}
