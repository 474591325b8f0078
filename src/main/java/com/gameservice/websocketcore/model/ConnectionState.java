package com.gameservice.websocketcore.model;

/* 연결 1개의 상태. INIT → ACTIVE → CLOSED, CLOSED 는 종착 상태. */
public enum ConnectionState {
    INIT,
    ACTIVE,
    CLOSED
}
