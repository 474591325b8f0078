package com.gameservice.websocketcore.model;

/**
 * @enum Role
 * @brief 세션 내 연결의 권한 구분. 착수 권한은 PLAYER1 / PLAYER2 만 가진다.
 */
public enum Role {

    PLAYER1("Player1"),
    PLAYER2("Player2"),
    SPECTATOR("Spectator");

    /** 와이어(JSON) 상 표기 */
    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isPlayer() {
        return this != SPECTATOR;
    }

    public Role opponent() {
        switch (this) {
            case PLAYER1:
                return PLAYER2;
            case PLAYER2:
                return PLAYER1;
            default:
                throw new IllegalStateException("관전자는 상대가 없습니다.");
        }
    }

    @Override
    public String toString() {
        return wireName;
    }
}
