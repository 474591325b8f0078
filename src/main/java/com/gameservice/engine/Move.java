package com.gameservice.engine;

import com.gameservice.websocketcore.model.Role;
import lombok.Getter;

/**
 * @class Move
 * @brief 적용이 끝난 한 수(누가, 어느 열에, 몇 번째 행에 놓였는지). 관전자 리플레이에 사용.
 */
@Getter
public class Move {

    private final Role player;
    private final int column;
    private final int row;

    public Move(Role player, int column, int row) {
        this.player = player;
        this.column = column;
        this.row = row;
    }

    @Override
    public String toString() {
        return "Move{" +
                "player=" + player +
                ", column=" + column +
                ", row=" + row +
                '}';
    }
}
