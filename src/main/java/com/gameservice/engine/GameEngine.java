package com.gameservice.engine;

import com.gameservice.engine.exception.IllegalMoveException;
import com.gameservice.websocketcore.model.Role;

import java.util.List;
import java.util.Optional;

/**
 * @interface GameEngine
 * @brief 게임 규칙 엔진. 세션은 이 인터페이스만 알고, 승리 판정 등 규칙 자체는 구현체 책임.
 *
 * 구현체는 스레드 안전할 필요가 없다. 호출 직렬화는 GameSession 의 착수 permit 이 보장한다.
 */
public interface GameEngine {

    /**
     * @param player 착수 역할(PLAYER1 / PLAYER2)
     * @param column 착수 열
     * @return 돌이 놓인 행
     * @throws IllegalMoveException 규칙 위반. 이 경우 상태는 변경되지 않아야 한다.
     */
    int applyMove(Role player, int column);

    /** 현재 승자. 아직 없으면 empty */
    Optional<Role> winner();

    /** 지금까지 적용된 수 (적용 순서) */
    List<Move> moves();
}
