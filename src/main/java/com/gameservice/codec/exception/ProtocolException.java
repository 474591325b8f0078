package com.gameservice.codec.exception;

/**
 * 형식상 올바른 JSON 이지만 프로토콜에 맞지 않는 메시지(알 수 없는 type, 필수 필드 누락/타입 불일치, 순서 위반).
 * 해당 연결만 종료 대상이며 세션에는 영향이 없다.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
