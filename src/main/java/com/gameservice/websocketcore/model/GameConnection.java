package com.gameservice.websocketcore.model;

import com.gameservice.codec.model.GameEvent;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * @interface GameConnection
 * @brief 전송 계층 연결에 대한 참조. 세션/레지스트리는 연결을 "참조"만 하며 수명은 전송 계층이 관리한다.
 */
public interface GameConnection {

    String getId();

    /**
     * 같은 연결에 대한 send 호출 순서대로 전달된다.
     * @throws IOException 전송 실패(이미 닫힌 연결 포함)
     */
    void send(GameEvent event) throws IOException;

    boolean isOpen();

    /* 전송 계층 종료 요청. 이미 닫혀 있으면 무시. 종료 콜백(afterConnectionClosed)은 전송 계층이 별도로 호출한다. */
    void close(CloseStatus status);
}
