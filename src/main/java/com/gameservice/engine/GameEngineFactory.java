package com.gameservice.engine;

/* 세션 1개당 엔진 1개 생성. 기본 구현은 GameServiceConfig 에서 ConnectFour 로 등록. */
@FunctionalInterface
public interface GameEngineFactory {

    GameEngine create();
}
