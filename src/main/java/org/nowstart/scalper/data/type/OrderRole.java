package org.nowstart.scalper.data.type;

public enum OrderRole {
    ENTRY,
    TAKE_PROFIT,
    STOP_LOSS
}
