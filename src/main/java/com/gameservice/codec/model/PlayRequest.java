package com.gameservice.codec.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/* 클라이언트 → 서버 착수 요청. 열 범위 검증은 엔진 책임. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class PlayRequest extends GameEvent {

    private final int column;

    public PlayRequest(int column) {
        super(EventType.PLAY);
        this.column = column;
    }
}
