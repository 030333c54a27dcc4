package org.nowstart.scalper.data.type;

public enum FillState {
    FILLED,
    PARTIALLY_FILLED,
    CANCELLED,
    TIMEOUT,
    SHUTDOWN
}
