package com.gameservice.websocketcore.core;

import com.gameservice.codec.GameEventCodec;
import com.gameservice.codec.model.GameEvent;
import com.gameservice.websocketcore.model.GameConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * @class WebSocketGameConnection
 * @brief WebSocketSession 을 GameConnection 으로 감싼 구현.
 *
 * 전달받는 session 은 ConcurrentWebSocketSessionDecorator 로 감싼 것이어야 한다
 * (여러 스레드의 동시 전송 직렬화 + 느린 클라이언트 전송 시간/버퍼 제한).
 */
public class WebSocketGameConnection implements GameConnection {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketGameConnection.class);

    private final WebSocketSession session;
    private final GameEventCodec gameEventCodec;

    public WebSocketGameConnection(WebSocketSession session, GameEventCodec gameEventCodec) {
        this.session = session;
        this.gameEventCodec = gameEventCodec;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(GameEvent event) throws IOException {
        session.sendMessage(new TextMessage(gameEventCodec.encode(event)));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            logger.warn("[close] 연결 종료 실패: connectionId={}, status={}, error={}", getId(), status, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketGameConnection{id=" + session.getId() + '}';
    }
}
