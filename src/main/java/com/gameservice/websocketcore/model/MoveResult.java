package com.gameservice.websocketcore.model;

import lombok.Getter;
import lombok.ToString;

/**
 * @class MoveResult
 * @brief 세션에 적용이 확정된 착수 결과(놓인 위치 + 이번 수로 승부가 났는지).
 */
@Getter
@ToString
public class MoveResult {

    private final Role player;
    private final int column;
    private final int row;
    private final boolean winning;

    public MoveResult(Role player, int column, int row, boolean winning) {
        this.player = player;
        this.column = column;
        this.row = row;
        this.winning = winning;
    }
}
