package org.nowstart.scalper.data.exception;

import lombok.Getter;

@Getter
public class PositionNotFoundException extends RuntimeException {

    private final String positionId;

    public PositionNotFoundException(String positionId) {
        super("Position not found: " + positionId);
        this.positionId = positionId;
    }
}
