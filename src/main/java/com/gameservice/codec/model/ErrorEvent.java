package com.gameservice.codec.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/* 서버 → 요청한 연결 하나. 다른 참여자에게는 절대 브로드캐스트하지 않는다. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class ErrorEvent extends GameEvent {

    private final String message;

    public ErrorEvent(String message) {
        super(EventType.ERROR);
        this.message = Objects.requireNonNull(message, "message");
    }
}
