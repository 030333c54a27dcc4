package org.nowstart.scalper.data.model;

public record TradingSignal(
        String pair,
        double indicatorValue,
        double confidence,
        String source
) {
}
