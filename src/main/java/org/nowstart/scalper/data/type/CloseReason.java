package org.nowstart.scalper.data.type;

public enum CloseReason {
    TAKE_PROFIT("take_profit"),
    STOP_LOSS("stop_loss"),
    TAKE_PROFIT_MANUAL("take_profit_manual"),
    POSITION_TIMEOUT("position_timeout"),
    EXIT_ORDERS_TIMEOUT("exit_orders_timeout"),
    EXIT_ORDERS_MISSING("exit_orders_missing"),
    EXIT_ORDER_CANCELLED("exit_order_cancelled"),
    BOTH_ORDERS_FILLED("both_orders_filled"),
    MANUAL("manual");

    private final String code;

    CloseReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
