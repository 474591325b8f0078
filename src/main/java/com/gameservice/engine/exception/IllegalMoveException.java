package com.gameservice.engine.exception;

/* 엔진이 규칙상 거부한 착수. 메시지는 그대로 클라이언트 error 이벤트로 전달되므로 사람이 읽을 수 있는 문장으로 작성한다. */
public class IllegalMoveException extends RuntimeException {

    public IllegalMoveException(String message) {
        super(message);
    }
}
