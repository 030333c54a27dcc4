package org.nowstart.scalper.data.type;

public enum OrderSide {
    BUY,
    SELL
}
