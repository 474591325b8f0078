package com.gameservice.websocketcore.model;

import com.gameservice.broadcast.BroadcastDispatcher;
import com.gameservice.codec.model.GameEvent;
import com.gameservice.codec.model.PlayEvent;
import com.gameservice.codec.model.WinEvent;
import com.gameservice.engine.GameEngine;
import com.gameservice.engine.Move;
import com.gameservice.engine.exception.IllegalMoveException;
import com.gameservice.websocketcore.exception.EngineFaultException;
import com.gameservice.websocketcore.exception.GameNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * @class GameSession
 * @brief 게임 1판의 공유 상태(엔진 1개) + 참여 연결 집합(연결 → 역할).
 *
 * [동시성 구조]
 * - mutationPermit : 세션 전용 공정(fair) 세마포어 1개. 착수/리플레이는 반드시 이 permit 을 잡고 수행하며,
 *                    브로드캐스트도 permit 보유 중에 끝내므로 각 연결이 받는 이벤트 순서 = 착수 적용 순서.
 * - attachments    : 세션 객체 모니터(this)로 보호. detach 는 permit 을 기다리지 않는다.
 * - 세션 간에는 어떤 락도 공유하지 않는다.
 *
 * [수명]
 * - 마지막 연결이 detach 되는 순간 onEmpty(레지스트리 해제)를 정확히 한 번 호출.
 * - 해제된 세션에는 다시 attach 할 수 없다(GameNotFoundException).
 */
public class GameSession {

    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    private static final Set<Role> ALL_ROLES = Collections.unmodifiableSet(EnumSet.allOf(Role.class));

    private final String joinToken;
    private final String watchToken;
    private final GameEngine engine;
    private final BroadcastDispatcher dispatcher;
    private final Consumer<GameSession> onEmpty;
    private final LocalDateTime createdAt;

    private final Semaphore mutationPermit = new Semaphore(1, true);

    /** guarded by this */
    private final Map<GameConnection, Role> attachments = new LinkedHashMap<>();
    /** guarded by this */
    private boolean released;

    private volatile boolean finished;
    private volatile int moveCount;

    public GameSession(String joinToken,
                       String watchToken,
                       GameEngine engine,
                       BroadcastDispatcher dispatcher,
                       Consumer<GameSession> onEmpty) {
        this.joinToken = joinToken;
        this.watchToken = watchToken;
        this.engine = engine;
        this.dispatcher = dispatcher;
        this.onEmpty = onEmpty;
        this.createdAt = LocalDateTime.now();
    }

    // =========================================================================
    // 1. [참여/이탈]
    // =========================================================================

    /**
     * @param connection    참여할 연결
     * @param requestedRole SPECTATOR 면 항상 관전자, 그 외에는 빈 자리 순서(PLAYER1 → PLAYER2 → SPECTATOR)로 배정
     * @return 참여권(역할 포함)
     * @throws GameNotFoundException 이미 해제된 세션
     *
     * 진행 중인 게임에 들어오는 연결에는 지금까지의 수를 play 이벤트로 먼저 보낸다.
     * permit 을 잡은 상태에서 보내므로 동시에 진행되는 착수 브로드캐스트와 섞이지 않는다.
     * 리플레이 중 엔진 오류가 나면 배정한 자리를 반납한 뒤 예외를 그대로 던진다.
     */
    public Attachment attach(GameConnection connection, Role requestedRole) {
        acquireMutationPermit();
        try {
            Role role;
            synchronized (this) {
                if (released) {
                    throw new GameNotFoundException();
                }
                if (attachments.containsKey(connection)) {
                    throw new IllegalStateException("이미 참여 중인 연결입니다: " + connection.getId());
                }
                role = assignRole(requestedRole);
                attachments.put(connection, role);
            }
            logger.info("[attach] joinToken={}, connectionId={}, requested={}, assigned={}",
                    joinToken, connection.getId(), requestedRole, role);

            try {
                replayTo(connection);
            } catch (RuntimeException e) {
                // 참여권을 돌려주지 못했으므로 자리도 여기서 회수
                detach(connection);
                throw e;
            }
            return new Attachment(this, connection, role);
        } finally {
            mutationPermit.release();
        }
    }

    /**
     * 연결 제거. 마지막 연결이면 레지스트리 해제까지 수행한다.
     * @return 실제로 제거했으면 true, 이미 없던 연결이면 false
     */
    public boolean detach(GameConnection connection) {
        Role removed;
        boolean becameEmpty = false;
        synchronized (this) {
            removed = attachments.remove(connection);
            if (removed == null) {
                return false;
            }
            if (attachments.isEmpty() && !released) {
                released = true;
                becameEmpty = true;
            }
        }
        logger.info("[detach] joinToken={}, connectionId={}, role={}, 남은 연결 수={}",
                joinToken, connection.getId(), removed, becameEmpty ? 0 : getAttachmentCount());

        if (becameEmpty) {
            onEmpty.accept(this);
        }
        return true;
    }

    /* 빈 자리 우선 배정, 배정 이후 재배정 없음 */
    private Role assignRole(Role requestedRole) {
        if (requestedRole == Role.SPECTATOR) {
            return Role.SPECTATOR;
        }
        if (!attachments.containsValue(Role.PLAYER1)) {
            return Role.PLAYER1;
        }
        if (!attachments.containsValue(Role.PLAYER2)) {
            return Role.PLAYER2;
        }
        return Role.SPECTATOR;
    }

    // =========================================================================
    // 2. [착수]
    // =========================================================================

    /**
     * @throws IllegalMoveException 관전자 착수, 종료된 게임, 엔진 규칙 위반. 상태 변경 없음
     * @throws EngineFaultException 엔진 내부 예외
     *
     * 성공 시 play 이벤트(승리 수라면 이어서 win 이벤트)를 전체 참여 연결에 permit 보유 상태로 브로드캐스트.
     */
    public MoveResult applyMove(Role role, int column) {
        if (role == null || !role.isPlayer()) {
            throw new IllegalMoveException("Spectators cannot play.");
        }

        acquireMutationPermit();
        try {
            if (finished) {
                throw new IllegalMoveException("Game is over.");
            }

            int row;
            Optional<Role> winner;
            try {
                row = engine.applyMove(role, column);
                winner = engine.winner();
            } catch (IllegalMoveException e) {
                logger.debug("[applyMove] 규칙 위반: joinToken={}, role={}, column={}, reason={}",
                        joinToken, role, column, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                throw new EngineFaultException("엔진 착수 처리 실패: joinToken=" + joinToken, e);
            }

            moveCount++;
            boolean winning = winner.isPresent();
            MoveResult result = new MoveResult(role, column, row, winning);
            logger.info("[applyMove] joinToken={}, result={}", joinToken, result);

            broadcast(new PlayEvent(role, column, row));
            if (winning) {
                finished = true;
                broadcast(new WinEvent(winner.get()));
            }
            return result;
        } finally {
            mutationPermit.release();
        }
    }

    // =========================================================================
    // 3. [브로드캐스트]
    // =========================================================================

    public int broadcast(GameEvent event) {
        return broadcast(event, ALL_ROLES);
    }

    /**
     * @param includeRoles 전송 대상 역할
     * @return 전송 성공 수
     */
    public int broadcast(GameEvent event, Set<Role> includeRoles) {
        List<GameConnection> targets = new ArrayList<>();
        synchronized (this) {
            for (Map.Entry<GameConnection, Role> entry : attachments.entrySet()) {
                if (includeRoles.contains(entry.getValue())) {
                    targets.add(entry.getKey());
                }
            }
        }
        return dispatcher.deliver(event, targets);
    }

    private void replayTo(GameConnection connection) {
        List<Move> moves;
        try {
            moves = engine.moves();
        } catch (RuntimeException e) {
            throw new EngineFaultException("엔진 기보 조회 실패: joinToken=" + joinToken, e);
        }
        if (moves.isEmpty()) {
            return;
        }
        List<GameConnection> target = Collections.singletonList(connection);
        for (Move move : moves) {
            dispatcher.deliver(new PlayEvent(move.getPlayer(), move.getColumn(), move.getRow()), target);
        }
        logger.info("[replay] joinToken={}, connectionId={}, moves={}", joinToken, connection.getId(), moves.size());
    }

    // =========================================================================
    // 4. [종료/정리]
    // =========================================================================

    /**
     * 세션 강제 종료. 모든 연결을 detach(→ 레지스트리 해제) 후 전송 계층 연결을 닫는다.
     * 승부가 난 직후, 서버 종료 시 호출.
     */
    public void terminate(CloseStatus status) {
        List<GameConnection> connections;
        boolean release;
        synchronized (this) {
            finished = true;
            connections = new ArrayList<>(attachments.keySet());
            attachments.clear();
            release = !released;
            released = true;
        }
        logger.info("[terminate] joinToken={}, 연결 수={}, status={}", joinToken, connections.size(), status);

        if (release) {
            onEmpty.accept(this);
        }
        for (GameConnection connection : connections) {
            connection.close(status);
        }
    }

    /**
     * 전송 계층은 이미 닫혔는데 종료 콜백이 오지 않은 연결을 detach.
     * @return detach 한 연결 수
     */
    public int detachClosedConnections() {
        List<GameConnection> stale = new ArrayList<>();
        synchronized (this) {
            for (GameConnection connection : attachments.keySet()) {
                if (!connection.isOpen()) {
                    stale.add(connection);
                }
            }
        }
        int detached = 0;
        for (GameConnection connection : stale) {
            if (detach(connection)) {
                detached++;
            }
        }
        return detached;
    }

    private void acquireMutationPermit() {
        try {
            mutationPermit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("세션 permit 대기 중 인터럽트: joinToken=" + joinToken, e);
        }
    }

    // =========================================================================
    // 5. [조회]
    // =========================================================================

    public String getJoinToken() {
        return joinToken;
    }

    public String getWatchToken() {
        return watchToken;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public boolean isFinished() {
        return finished;
    }

    public int getMoveCount() {
        return moveCount;
    }

    public synchronized boolean isReleased() {
        return released;
    }

    public synchronized int getAttachmentCount() {
        return attachments.size();
    }

    public synchronized Optional<Role> roleOf(GameConnection connection) {
        return Optional.ofNullable(attachments.get(connection));
    }

    /** 현재 착석 중인 플레이어 역할 */
    public synchronized List<Role> getSeatedPlayers() {
        List<Role> players = new ArrayList<>();
        for (Role role : attachments.values()) {
            if (role.isPlayer()) {
                players.add(role);
            }
        }
        Collections.sort(players);
        return players;
    }

    public synchronized int getSpectatorCount() {
        int count = 0;
        for (Role role : attachments.values()) {
            if (role == Role.SPECTATOR) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "GameSession{" +
                "joinToken='" + joinToken + '\'' +
                ", moveCount=" + moveCount +
                ", finished=" + finished +
                ", createdAt=" + createdAt +
                '}';
    }
}
