package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.data.property.TradingProperties.PairPrecision;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OrderPricingService {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final TradingProperties tradingProperties;

    /**
     * Rounds to the nearest multiple of the pair's tick size.
     */
    public BigDecimal roundPrice(String pair, BigDecimal price) {
        BigDecimal tick = tradingProperties.precisionFor(pair).effectiveTickSize();
        return price.divide(tick, 0, RoundingMode.HALF_UP)
                .multiply(tick)
                .setScale(Math.max(tick.scale(), 0), RoundingMode.HALF_UP);
    }

    /**
     * Rounds down so an order never asks for more than is held.
     */
    public BigDecimal roundQuantity(String pair, BigDecimal quantity) {
        PairPrecision precision = tradingProperties.precisionFor(pair);
        return quantity.setScale(precision.quantityDecimals(), RoundingMode.DOWN);
    }

    public BigDecimal quantityFor(String pair, BigDecimal notional, BigDecimal price) {
        PairPrecision precision = tradingProperties.precisionFor(pair);
        BigDecimal raw = notional.divide(price, precision.quantityDecimals() + 4, RoundingMode.DOWN);
        return roundQuantity(pair, raw);
    }

    public BigDecimal takeProfitPrice(BigDecimal entryPrice) {
        return entryPrice.multiply(BigDecimal.ONE.add(tradingProperties.takeProfitPct().movePointLeft(2)));
    }

    public BigDecimal stopLossPrice(BigDecimal entryPrice) {
        return entryPrice.multiply(BigDecimal.ONE.subtract(tradingProperties.stopLossPct().movePointLeft(2)));
    }

    public BigDecimal protectiveTakeProfit(String pair, BigDecimal entryPrice) {
        return roundPrice(pair, takeProfitPrice(entryPrice));
    }

    public BigDecimal protectiveStopLoss(String pair, BigDecimal entryPrice) {
        return roundPrice(pair, stopLossPrice(entryPrice));
    }

    /**
     * Inverse of {@link #takeProfitPrice(BigDecimal)} used when rebuilding a position from its
     * resting exit orders.
     */
    public BigDecimal inferEntryFromTakeProfit(String pair, BigDecimal takeProfitPrice) {
        BigDecimal divisor = BigDecimal.ONE.add(tradingProperties.takeProfitPct().divide(ONE_HUNDRED, MathContext.DECIMAL64));
        return roundPrice(pair, takeProfitPrice.divide(divisor, MathContext.DECIMAL64));
    }

    public BigDecimal realizedPnl(BigDecimal entryPrice, BigDecimal exitPrice, BigDecimal quantity) {
        return exitPrice.subtract(entryPrice).multiply(quantity);
    }

    /**
     * Quote currency needed to open a position of {@code notional}, including taker fee and the
     * configured safety margin.
     */
    public BigDecimal requiredQuoteBalance(BigDecimal notional) {
        BigDecimal fee = notional.multiply(tradingProperties.takerFeeRate());
        BigDecimal margin = notional.multiply(tradingProperties.balanceSafetyMarginPct().movePointLeft(2));
        return notional.add(fee).add(margin);
    }
}
