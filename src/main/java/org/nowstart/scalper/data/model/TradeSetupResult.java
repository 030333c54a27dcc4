package org.nowstart.scalper.data.model;

import org.nowstart.scalper.data.type.NoTradeReason;

public sealed interface TradeSetupResult permits TradeSetupResult.Opened, TradeSetupResult.NoTrade {

    static TradeSetupResult opened(Position position) {
        return new Opened(position);
    }

    static TradeSetupResult noTrade(NoTradeReason reason, String detail) {
        return new NoTrade(reason, detail);
    }

    record Opened(Position position) implements TradeSetupResult {
    }

    record NoTrade(NoTradeReason reason, String detail) implements TradeSetupResult {
    }
}
