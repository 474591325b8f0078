package com.gameservice.codec.model;

import java.util.Objects;

/**
 * @class GameEvent
 * @brief WebSocket 메시지 봉투의 공통 상위 타입. 생성 후 불변.
 *
 * 하위 타입은 이 패키지 안의 고정된 집합(InitRequest, InitResponse, PlayRequest, PlayEvent, WinEvent, ErrorEvent)뿐이며,
 * 외부 패키지에서 임의로 확장할 수 없도록 생성자를 package-private 으로 둔다.
 */
public abstract class GameEvent {

    private final EventType type;

    GameEvent(EventType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public EventType getType() {
        return type;
    }
}
