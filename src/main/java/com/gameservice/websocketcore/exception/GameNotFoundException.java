package com.gameservice.websocketcore.exception;

/* 존재하지 않거나 이미 해제된 세션 토큰. 요청한 연결에만 알리고 세션에는 영향 없음. */
public class GameNotFoundException extends RuntimeException {

    public static final String MESSAGE = "Game not found.";

    public GameNotFoundException() {
        super(MESSAGE);
    }
}
