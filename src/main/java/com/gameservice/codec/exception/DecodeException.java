package com.gameservice.codec.exception;

/* JSON 자체가 깨진 경우. 프로토콜 위반의 한 종류로 취급하되 종료 코드는 BAD_DATA 로 구분한다. */
public class DecodeException extends ProtocolException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
