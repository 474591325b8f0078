package com.gameservice.codec.model;

import java.util.Optional;

/**
 * @enum EventType
 * @brief 메시지 봉투의 "type" 태그. 방향(클라이언트→서버 수신 허용 여부)까지 함께 정의.
 */
public enum EventType {

    INIT("init", true),
    PLAY("play", true),
    WIN("win", false),
    ERROR("error", false);

    private final String tag;
    /** 클라이언트가 보낼 수 있는 태그인지 */
    private final boolean inbound;

    EventType(String tag, boolean inbound) {
        this.tag = tag;
        this.inbound = inbound;
    }

    public String getTag() {
        return tag;
    }

    public boolean isInbound() {
        return inbound;
    }

    public static Optional<EventType> fromTag(String tag) {
        for (EventType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
