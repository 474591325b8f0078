package com.gameservice.broadcast;

import com.gameservice.codec.model.GameEvent;
import com.gameservice.websocketcore.model.GameConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.Collection;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * @class BroadcastDispatcher
 * @brief 하나의 이벤트를 여러 연결에 개별 전송. 한 연결의 전송 실패가 나머지 전송을 막지 않는다.
 *
 * - 실패한 연결은 connectionCloseExecutor 에서 비동기로 종료 → 해당 연결의 afterConnectionClosed 에서 detach
 * - 연결 간 전송 순서는 보장하지 않음. 한 연결 안의 순서는 호출 순서(세션 permit 보유 중 호출)를 따른다
 */
@Component
public class BroadcastDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final Executor connectionCloseExecutor;

    public BroadcastDispatcher(@Qualifier("connectionCloseExecutor") Executor connectionCloseExecutor) {
        this.connectionCloseExecutor = connectionCloseExecutor;
    }

    /**
     * @return 실제 전송 성공 수
     */
    public int deliver(GameEvent event, Collection<? extends GameConnection> connections) {
        int sendCount = 0;
        for (GameConnection connection : connections) {
            if (!connection.isOpen()) {
                logger.debug("[broadcast] 닫힌 연결 건너뜀: connectionId={}", connection.getId());
                continue;
            }
            try {
                connection.send(event);
                sendCount++;
            } catch (Exception e) {
                logger.error("[broadcast] 메시지 전송 실패: connectionId={}, type={}, error={}",
                        connection.getId(), event.getType(), e.getMessage());
                closeAsync(connection);
            }
        }
        logger.debug("[broadcast] type={}, 대상={}, 전송 성공={}", event.getType(), connections.size(), sendCount);
        return sendCount;
    }

    private void closeAsync(GameConnection connection) {
        try {
            connectionCloseExecutor.execute(() -> connection.close(CloseStatus.SESSION_NOT_RELIABLE));
        } catch (RejectedExecutionException e) {
            // 종료 중인 executor. 호출 스레드에서 바로 닫는다
            logger.warn("[broadcast] 종료 작업 등록 거부, 즉시 종료: connectionId={}", connection.getId());
            connection.close(CloseStatus.SESSION_NOT_RELIABLE);
        }
    }
}
