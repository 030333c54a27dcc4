package org.nowstart.scalper.data.type;

public enum NoTradeReason {
    SHUTTING_DOWN,
    DAILY_LIMIT_REACHED,
    POSITION_ALREADY_OPEN,
    NO_MARKET_DATA,
    INVALID_QUANTITY,
    INSUFFICIENT_BALANCE,
    NOT_FILLED,
    EXCHANGE_ERROR,
    PROTECTION_FAILED
}
