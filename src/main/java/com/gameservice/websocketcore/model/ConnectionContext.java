package com.gameservice.websocketcore.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * @class ConnectionContext
 * @brief 연결 1개의 상태 머신(INIT → ACTIVE → CLOSED)과 세션 참여권 보관.
 *
 * CLOSED 진입은 원인과 관계없이 close() 한 곳으로 모이고, 참여권이 있으면 반드시 detach 한다.
 */
public class ConnectionContext {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionContext.class);

    private final GameConnection connection;

    private ConnectionState state = ConnectionState.INIT;
    private Attachment attachment;

    public ConnectionContext(GameConnection connection) {
        this.connection = connection;
    }

    /**
     * INIT → ACTIVE.
     * @return 이미 CLOSED 로 전이된 뒤라면 false (호출 측이 참여권을 반납해야 함)
     */
    public synchronized boolean activate(Attachment attachment) {
        if (state != ConnectionState.INIT) {
            logger.debug("[activate] 전이 불가: connectionId={}, state={}", connection.getId(), state);
            return false;
        }
        this.attachment = attachment;
        this.state = ConnectionState.ACTIVE;
        return true;
    }

    /**
     * 모든 상태 → CLOSED. 참여권이 있으면 detach.
     * @return 이번 호출로 CLOSED 가 되었으면 true
     */
    public synchronized boolean close() {
        if (state == ConnectionState.CLOSED) {
            return false;
        }
        state = ConnectionState.CLOSED;
        if (attachment != null) {
            attachment.close();
        }
        return true;
    }

    public GameConnection getConnection() {
        return connection;
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized Optional<Attachment> getAttachment() {
        return Optional.ofNullable(attachment);
    }
}
