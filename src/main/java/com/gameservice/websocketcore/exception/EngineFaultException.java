package com.gameservice.websocketcore.exception;

/**
 * 게임 엔진 내부의 예상치 못한 오류(IllegalMoveException 이외의 모든 런타임 예외).
 * 원인 연결만 종료하고, 다른 참여자가 남아 있으면 세션은 유지한다.
 */
public class EngineFaultException extends RuntimeException {

    public static final String CLIENT_MESSAGE = "Internal error.";

    public EngineFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
