package org.nowstart.scalper.data.type;

public enum PositionStatus {
    OPEN,
    CLOSED
}
