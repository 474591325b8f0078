package com.gameservice.codec.model;

import com.gameservice.websocketcore.model.Role;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class WinEvent extends GameEvent {

    private final Role player;

    public WinEvent(Role player) {
        super(EventType.WIN);
        this.player = Objects.requireNonNull(player, "player");
    }
}
