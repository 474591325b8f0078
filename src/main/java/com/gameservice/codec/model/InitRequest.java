package com.gameservice.codec.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 클라이언트 → 서버 첫 메시지.
 * join / watch 모두 null 이면 새 게임 생성, join 이면 대국 참가, watch 면 관전.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class InitRequest extends GameEvent {

    private final String joinToken;
    private final String watchToken;

    private InitRequest(String joinToken, String watchToken) {
        super(EventType.INIT);
        this.joinToken = joinToken;
        this.watchToken = watchToken;
    }

    public static InitRequest create() {
        return new InitRequest(null, null);
    }

    public static InitRequest join(String joinToken) {
        return new InitRequest(joinToken, null);
    }

    public static InitRequest watch(String watchToken) {
        return new InitRequest(null, watchToken);
    }

    public boolean isCreate() {
        return joinToken == null && watchToken == null;
    }

    public boolean isJoin() {
        return joinToken != null;
    }

    public boolean isWatch() {
        return watchToken != null;
    }
}
