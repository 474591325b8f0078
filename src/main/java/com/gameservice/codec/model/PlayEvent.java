package com.gameservice.codec.model;

import com.gameservice.websocketcore.model.Role;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/* 서버 → 세션 전체. 적용이 확정된 착수 결과. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class PlayEvent extends GameEvent {

    private final Role player;
    private final int column;
    private final int row;

    public PlayEvent(Role player, int column, int row) {
        super(EventType.PLAY);
        this.player = Objects.requireNonNull(player, "player");
        this.column = column;
        this.row = row;
    }
}
