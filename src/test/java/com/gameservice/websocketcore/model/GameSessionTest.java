package com.gameservice.websocketcore.model;

import com.gameservice.broadcast.BroadcastDispatcher;
import com.gameservice.codec.model.ErrorEvent;
import com.gameservice.codec.model.GameEvent;
import com.gameservice.codec.model.PlayEvent;
import com.gameservice.codec.model.WinEvent;
import com.gameservice.engine.ConnectFour;
import com.gameservice.engine.GameEngine;
import com.gameservice.engine.Move;
import com.gameservice.engine.exception.IllegalMoveException;
import com.gameservice.support.RecordingConnection;
import com.gameservice.websocketcore.exception.EngineFaultException;
import com.gameservice.websocketcore.exception.GameNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GameSessionTest {

    private BroadcastDispatcher dispatcher;
    private AtomicInteger releaseCount;
    private GameSession session;

    @BeforeEach
    void setUp() {
        dispatcher = new BroadcastDispatcher(Runnable::run);
        releaseCount = new AtomicInteger();
        session = newSession(new ConnectFour());
    }

    private GameSession newSession(GameEngine engine) {
        return new GameSession("join", "watch", engine, dispatcher, s -> releaseCount.incrementAndGet());
    }

    @Test
    void testRoleAssignment() {
        Attachment first = session.attach(new RecordingConnection("c1"), Role.PLAYER1);
        Attachment second = session.attach(new RecordingConnection("c2"), Role.PLAYER2);
        Attachment third = session.attach(new RecordingConnection("c3"), Role.PLAYER2);
        Attachment watcher = session.attach(new RecordingConnection("c4"), Role.SPECTATOR);

        assertEquals(Role.PLAYER1, first.getRole());
        assertEquals(Role.PLAYER2, second.getRole());
        assertEquals(Role.SPECTATOR, third.getRole());
        assertEquals(Role.SPECTATOR, watcher.getRole());
        assertEquals(Arrays.asList(Role.PLAYER1, Role.PLAYER2), session.getSeatedPlayers());
        assertEquals(2, session.getSpectatorCount());
    }

    @Test
    void testSpectatorRequestNeverTakesSeat() {
        Attachment watcher = session.attach(new RecordingConnection("c1"), Role.SPECTATOR);

        assertEquals(Role.SPECTATOR, watcher.getRole());
        assertTrue(session.getSeatedPlayers().isEmpty());
    }

    @Test
    void testVacatedSeatIsReused() {
        Attachment first = session.attach(new RecordingConnection("c1"), Role.PLAYER1);
        session.attach(new RecordingConnection("c2"), Role.PLAYER2);

        first.close();
        Attachment rejoin = session.attach(new RecordingConnection("c3"), Role.PLAYER2);

        assertEquals(Role.PLAYER1, rejoin.getRole());
    }

    @Test
    void testDuplicateAttachRejected() {
        RecordingConnection connection = new RecordingConnection("c1");
        session.attach(connection, Role.PLAYER1);

        assertThrows(IllegalStateException.class, () -> session.attach(connection, Role.PLAYER2));
        assertEquals(1, session.getAttachmentCount());
    }

    @Test
    void testLastDetachReleasesOnce() {
        Attachment first = session.attach(new RecordingConnection("c1"), Role.PLAYER1);
        Attachment second = session.attach(new RecordingConnection("c2"), Role.PLAYER2);

        first.close();
        assertEquals(0, releaseCount.get());

        second.close();
        second.close();
        assertEquals(1, releaseCount.get());
        assertTrue(session.isReleased());
        assertTrue(second.isClosed());
    }

    @Test
    void testAttachAfterReleaseFails() {
        session.attach(new RecordingConnection("c1"), Role.PLAYER1).close();

        assertThrows(GameNotFoundException.class,
                () -> session.attach(new RecordingConnection("c2"), Role.PLAYER2));
    }

    @Test
    void testDetachUnknownConnection() {
        assertFalse(session.detach(new RecordingConnection("ghost")));
        assertEquals(0, releaseCount.get());
    }

    @Test
    void testMoveBroadcastToEveryAttachment() {
        RecordingConnection p1 = new RecordingConnection("p1");
        RecordingConnection p2 = new RecordingConnection("p2");
        RecordingConnection watcher = new RecordingConnection("w");
        session.attach(p1, Role.PLAYER1);
        session.attach(p2, Role.PLAYER2);
        session.attach(watcher, Role.SPECTATOR);

        MoveResult result = session.applyMove(Role.PLAYER1, 3);

        assertEquals(0, result.getRow());
        assertFalse(result.isWinning());
        PlayEvent expected = new PlayEvent(Role.PLAYER1, 3, 0);
        assertEquals(Collections.singletonList(expected), p1.getEvents());
        assertEquals(Collections.singletonList(expected), p2.getEvents());
        assertEquals(Collections.singletonList(expected), watcher.getEvents());
        assertEquals(1, session.getMoveCount());
    }

    @Test
    void testIllegalMoveLeavesStateUnchanged() {
        RecordingConnection p1 = new RecordingConnection("p1");
        session.attach(p1, Role.PLAYER1);
        session.attach(new RecordingConnection("p2"), Role.PLAYER2);

        IllegalMoveException e = assertThrows(IllegalMoveException.class, () -> session.applyMove(Role.PLAYER2, 0));

        assertEquals("It isn't your turn.", e.getMessage());
        assertEquals(0, session.getMoveCount());
        assertTrue(p1.getEvents().isEmpty());
    }

    @Test
    void testSpectatorCannotMove() {
        IllegalMoveException e = assertThrows(IllegalMoveException.class, () -> session.applyMove(Role.SPECTATOR, 0));
        assertEquals("Spectators cannot play.", e.getMessage());
    }

    @Test
    void testWinningMoveBroadcastsPlayThenWin() {
        RecordingConnection p1 = new RecordingConnection("p1");
        session.attach(p1, Role.PLAYER1);
        session.attach(new RecordingConnection("p2"), Role.PLAYER2);
        for (int i = 0; i < 3; i++) {
            session.applyMove(Role.PLAYER1, 0);
            session.applyMove(Role.PLAYER2, 1);
        }

        MoveResult result = session.applyMove(Role.PLAYER1, 0);

        assertTrue(result.isWinning());
        assertTrue(session.isFinished());
        List<GameEvent> events = p1.getEvents();
        assertEquals(new PlayEvent(Role.PLAYER1, 0, 3), events.get(events.size() - 2));
        assertEquals(new WinEvent(Role.PLAYER1), events.get(events.size() - 1));

        IllegalMoveException e = assertThrows(IllegalMoveException.class, () -> session.applyMove(Role.PLAYER2, 1));
        assertEquals("Game is over.", e.getMessage());
    }

    @Test
    void testEngineFault() {
        GameEngine broken = new FreePlayEngine() {
            @Override
            public int applyMove(Role player, int column) {
                throw new ArrayIndexOutOfBoundsException(column);
            }
        };
        GameSession faulty = newSession(broken);
        RecordingConnection p1 = new RecordingConnection("p1");
        faulty.attach(p1, Role.PLAYER1);

        assertThrows(EngineFaultException.class, () -> faulty.applyMove(Role.PLAYER1, 0));
        assertTrue(p1.getEvents().isEmpty());
        assertEquals(0, faulty.getMoveCount());
    }

    @Test
    void testReplayFaultReturnsSeat() {
        GameEngine noHistory = new FreePlayEngine() {
            @Override
            public List<Move> moves() {
                throw new IllegalStateException("history unavailable");
            }
        };
        GameSession faulty = newSession(noHistory);
        RecordingConnection connection = new RecordingConnection("c1");

        assertThrows(EngineFaultException.class, () -> faulty.attach(connection, Role.PLAYER1));

        assertEquals(0, faulty.getAttachmentCount());
        assertEquals(Optional.empty(), faulty.roleOf(connection));
        assertTrue(faulty.isReleased());
        assertEquals(1, releaseCount.get());
    }

    @Test
    void testReplayFaultKeepsOtherAttachments() {
        GameSession faulty = newSession(new ConnectFour() {
            @Override
            public List<Move> moves() {
                List<Move> moves = super.moves();
                if (!moves.isEmpty()) {
                    throw new IllegalStateException("history unavailable");
                }
                return moves;
            }
        });
        RecordingConnection p1 = new RecordingConnection("p1");
        faulty.attach(p1, Role.PLAYER1);
        faulty.applyMove(Role.PLAYER1, 0);

        RecordingConnection late = new RecordingConnection("late");
        assertThrows(EngineFaultException.class, () -> faulty.attach(late, Role.PLAYER2));

        assertEquals(Collections.singletonList(Role.PLAYER1), faulty.getSeatedPlayers());
        assertEquals(Optional.empty(), faulty.roleOf(late));
        assertFalse(faulty.isReleased());
    }

    @Test
    void testConcurrentAttachSeatsOnePlayerEach() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Role>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final RecordingConnection connection = new RecordingConnection("c" + t);
            futures.add(pool.submit(() -> {
                start.await();
                return session.attach(connection, Role.PLAYER2).getRole();
            }));
        }
        start.countDown();

        List<Role> assigned = new ArrayList<>();
        for (Future<Role> future : futures) {
            assigned.add(future.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertEquals(1, Collections.frequency(assigned, Role.PLAYER1));
        assertEquals(1, Collections.frequency(assigned, Role.PLAYER2));
        assertEquals(threads - 2, Collections.frequency(assigned, Role.SPECTATOR));
        assertEquals(Arrays.asList(Role.PLAYER1, Role.PLAYER2), session.getSeatedPlayers());
        assertEquals(threads - 2, session.getSpectatorCount());
    }

    @Test
    void testLateJoinerReceivesReplay() {
        session.attach(new RecordingConnection("p1"), Role.PLAYER1);
        session.attach(new RecordingConnection("p2"), Role.PLAYER2);
        session.applyMove(Role.PLAYER1, 3);
        session.applyMove(Role.PLAYER2, 3);

        RecordingConnection watcher = new RecordingConnection("w");
        session.attach(watcher, Role.SPECTATOR);

        assertEquals(Arrays.asList(
                new PlayEvent(Role.PLAYER1, 3, 0),
                new PlayEvent(Role.PLAYER2, 3, 1)), watcher.getEvents());
    }

    @Test
    void testBroadcastToSelectedRoles() {
        RecordingConnection p1 = new RecordingConnection("p1");
        RecordingConnection watcher = new RecordingConnection("w");
        session.attach(p1, Role.PLAYER1);
        session.attach(watcher, Role.SPECTATOR);

        int sent = session.broadcast(new ErrorEvent("notice"), EnumSet.of(Role.SPECTATOR));

        assertEquals(1, sent);
        assertTrue(p1.getEvents().isEmpty());
        assertEquals(new ErrorEvent("notice"), watcher.lastEvent());
    }

    @Test
    void testTerminateDetachesAndClosesAll() {
        RecordingConnection p1 = new RecordingConnection("p1");
        RecordingConnection p2 = new RecordingConnection("p2");
        Attachment a1 = session.attach(p1, Role.PLAYER1);
        session.attach(p2, Role.PLAYER2);

        session.terminate(CloseStatus.GOING_AWAY);

        assertEquals(0, session.getAttachmentCount());
        assertEquals(1, releaseCount.get());
        assertEquals(CloseStatus.GOING_AWAY, p1.getCloseStatus());
        assertEquals(CloseStatus.GOING_AWAY, p2.getCloseStatus());

        // 이후 개별 참여권 반납은 아무 영향 없음
        a1.close();
        assertEquals(1, releaseCount.get());
    }

    @Test
    void testDetachClosedConnections() {
        RecordingConnection alive = new RecordingConnection("alive");
        RecordingConnection dropped = new RecordingConnection("dropped");
        session.attach(alive, Role.PLAYER1);
        session.attach(dropped, Role.PLAYER2);
        dropped.drop();

        assertEquals(1, session.detachClosedConnections());
        assertEquals(Optional.empty(), session.roleOf(dropped));
        assertEquals(Optional.of(Role.PLAYER1), session.roleOf(alive));
        assertFalse(session.isReleased());
    }

    @Test
    void testConcurrentMovesSeenInSameOrderByAll() throws Exception {
        GameSession free = newSession(new FreePlayEngine());
        List<RecordingConnection> connections = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            RecordingConnection connection = new RecordingConnection("c" + i);
            connections.add(connection);
            free.attach(connection, i < 2 ? Role.PLAYER1 : Role.SPECTATOR);
        }

        int threads = 8;
        int movesPerThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int column = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int m = 0; m < movesPerThread; m++) {
                    free.applyMove(column % 2 == 0 ? Role.PLAYER1 : Role.PLAYER2, column);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<GameEvent> reference = connections.get(0).getEvents();
        assertEquals(threads * movesPerThread, reference.size());
        assertEquals(threads * movesPerThread, free.getMoveCount());
        for (RecordingConnection connection : connections) {
            assertEquals(reference, connection.getEvents());
        }
        // row 는 엔진 적용 순번. 모든 연결이 적용 순서대로 받았는지 확인
        for (int i = 0; i < reference.size(); i++) {
            assertEquals(i, ((PlayEvent) reference.get(i)).getRow());
        }
    }

    /* 차례/열 제한 없이 모든 착수를 받아들이고 적용 순번을 row 로 돌려주는 엔진 */
    private static class FreePlayEngine implements GameEngine {

        private final List<Move> moves = new ArrayList<>();

        @Override
        public int applyMove(Role player, int column) {
            int row = moves.size();
            moves.add(new Move(player, column, row));
            return row;
        }

        @Override
        public Optional<Role> winner() {
            return Optional.empty();
        }

        @Override
        public List<Move> moves() {
            return new ArrayList<>(moves);
        }
    }
}
