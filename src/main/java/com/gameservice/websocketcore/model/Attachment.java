package com.gameservice.websocketcore.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * @class Attachment
 * @brief 연결 1개의 세션 참여권. close() 가 곧 detach 이며 여러 번 호출해도 한 번만 반영된다.
 *
 * 정상 종료, 프로토콜 위반, 전송 오류, 서버 종료 등 어떤 경로로 끝나든 ConnectionContext 가 close() 를 호출한다.
 */
public class Attachment implements AutoCloseable {

    private final GameSession session;
    private final GameConnection connection;
    private final Role role;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Attachment(GameSession session, GameConnection connection, Role role) {
        this.session = session;
        this.connection = connection;
        this.role = role;
    }

    public GameSession getSession() {
        return session;
    }

    public Role getRole() {
        return role;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            session.detach(connection);
        }
    }
}
