package org.nowstart.scalper.data.dto;

import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.model.TradeSetupResult;

public record TradeSetupResponse(
        boolean opened,
        String reason,
        String detail,
        Position position
) {

    public static TradeSetupResponse from(TradeSetupResult result) {
        if (result instanceof TradeSetupResult.Opened opened) {
            return new TradeSetupResponse(true, null, null, opened.position());
        }
        TradeSetupResult.NoTrade noTrade = (TradeSetupResult.NoTrade) result;
        return new TradeSetupResponse(false, noTrade.reason().name(), noTrade.detail(), null);
    }
}
