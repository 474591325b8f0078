package com.gameservice.codec.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/* 서버 → 게임 생성자. 참가용 토큰과 관전용 토큰을 함께 내려준다. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class InitResponse extends GameEvent {

    private final String joinToken;
    private final String watchToken;

    public InitResponse(String joinToken, String watchToken) {
        super(EventType.INIT);
        this.joinToken = Objects.requireNonNull(joinToken, "joinToken");
        this.watchToken = Objects.requireNonNull(watchToken, "watchToken");
    }
}
