package com.gameservice.websocketcore.model;

import com.gameservice.broadcast.BroadcastDispatcher;
import com.gameservice.engine.GameEngineFactory;
import com.gameservice.websocketcore.exception.GameNotFoundException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @class GameSessionRegistry
 * @brief 프로세스 내 살아 있는 GameSession 전체를 토큰으로 관리하는 레지스트리.
 *
 * - 참가 토큰(join)과 관전 토큰(watch)은 별도 네임스페이스, 둘 다 같은 세션을 가리킨다.
 * - 모든 연산은 ConcurrentHashMap 단위 원자 연산만 사용(전역 락 없음).
 * - 세션은 마지막 연결이 detach 되는 순간 GameSession 이 release 를 호출해 제거된다.
 *
 * 다중 인스턴스 확장 시 create/release 시점에 외부 pub/sub 으로 토큰 소유 정보를 전파하는 지점이 이 클래스다.
 */
@Component
public class GameSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GameSessionRegistry.class);

    /** 참가 토큰 → 세션 */
    private final Map<String, GameSession> sessionsByJoinToken = new ConcurrentHashMap<>();
    /** 관전 토큰 → 세션 */
    private final Map<String, GameSession> sessionsByWatchToken = new ConcurrentHashMap<>();

    private final SessionTokenGenerator tokenGenerator;
    private final GameEngineFactory gameEngineFactory;
    private final BroadcastDispatcher broadcastDispatcher;

    public GameSessionRegistry(SessionTokenGenerator tokenGenerator,
                               GameEngineFactory gameEngineFactory,
                               BroadcastDispatcher broadcastDispatcher) {
        this.tokenGenerator = tokenGenerator;
        this.gameEngineFactory = gameEngineFactory;
        this.broadcastDispatcher = broadcastDispatcher;
    }

    /**
     * @method create
     * @brief 새 세션 생성 및 등록. 토큰 충돌 시 실패하지 않고 재발급한다.
     */
    public GameSession create() {
        while (true) {
            String joinToken = tokenGenerator.nextToken();
            String watchToken = tokenGenerator.nextToken();
            if (joinToken.equals(watchToken)) {
                continue;
            }

            GameSession session = new GameSession(joinToken, watchToken,
                    gameEngineFactory.create(), broadcastDispatcher, this::release);

            if (sessionsByJoinToken.putIfAbsent(joinToken, session) != null) {
                logger.warn("[create] 참가 토큰 충돌, 재발급");
                continue;
            }
            if (sessionsByWatchToken.putIfAbsent(watchToken, session) != null) {
                sessionsByJoinToken.remove(joinToken, session);
                logger.warn("[create] 관전 토큰 충돌, 재발급");
                continue;
            }

            logger.info("[create] 신규 세션 등록: joinToken={}, 전체 세션 수={}", joinToken, sessionsByJoinToken.size());
            return session;
        }
    }

    /**
     * @throws GameNotFoundException 참가 토큰에 해당하는 세션 없음
     */
    public GameSession lookup(String joinToken) {
        GameSession session = (joinToken == null) ? null : sessionsByJoinToken.get(joinToken);
        if (session == null) {
            logger.debug("[lookup] 세션 없음: joinToken={}", joinToken);
            throw new GameNotFoundException();
        }
        return session;
    }

    /**
     * @throws GameNotFoundException 관전 토큰에 해당하는 세션 없음
     */
    public GameSession lookupWatch(String watchToken) {
        GameSession session = (watchToken == null) ? null : sessionsByWatchToken.get(watchToken);
        if (session == null) {
            logger.debug("[lookupWatch] 세션 없음: watchToken={}", watchToken);
            throw new GameNotFoundException();
        }
        return session;
    }

    /**
     * @method release
     * @brief 세션 제거. 이미 제거된 토큰이면 아무 일도 하지 않는다.
     */
    public void release(String joinToken) {
        GameSession session = sessionsByJoinToken.get(joinToken);
        if (session != null) {
            release(session);
        }
    }

    private void release(GameSession session) {
        if (sessionsByJoinToken.remove(session.getJoinToken(), session)) {
            sessionsByWatchToken.remove(session.getWatchToken(), session);
            logger.info("[release] 세션 해제: joinToken={}, 남은 세션 수={}", session.getJoinToken(), sessionsByJoinToken.size());
        }
    }

    /**
     * @method reapStaleConnections
     * @brief 닫힌 연결 정리(스케줄러 호출). 정리 결과 비게 된 세션은 detach 과정에서 해제된다.
     * @return 정리된 연결 수
     */
    public int reapStaleConnections() {
        int reaped = 0;
        for (GameSession session : getSessions()) {
            reaped += session.detachClosedConnections();
        }
        return reaped;
    }

    /* 애플리케이션 종료 시 모든 세션 정리(detach 보장) */
    @PreDestroy
    public void shutdown() {
        List<GameSession> sessions = getSessions();
        logger.info("[shutdown] 세션 {}개 종료", sessions.size());
        for (GameSession session : sessions) {
            try {
                session.terminate(CloseStatus.GOING_AWAY);
            } catch (RuntimeException e) {
                logger.error("[shutdown] 세션 종료 실패: joinToken={}", session.getJoinToken(), e);
            }
        }
    }

    public List<GameSession> getSessions() {
        return new ArrayList<>(sessionsByJoinToken.values());
    }

    public int size() {
        return sessionsByJoinToken.size();
    }
}
