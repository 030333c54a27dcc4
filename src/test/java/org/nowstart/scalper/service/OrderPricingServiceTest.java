package org.nowstart.scalper.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.nowstart.scalper.support.TradingPropertiesFixture;

class OrderPricingServiceTest {

    private final OrderPricingService service = new OrderPricingService(TradingPropertiesFixture.builder()
            .takeProfitPct("1.5")
            .stopLossPct("2.0")
            .precision("XRPZAR", 4, 2, null)
            .precision("ETHZAR", 0, 6, "1")
            .build());

    @Test
    void protectivePrices_roundToTick() {
        BigDecimal entry = new BigDecimal("100");

        assertThat(service.protectiveTakeProfit("BTCZAR", entry).toPlainString()).isEqualTo("101.50");
        assertThat(service.protectiveStopLoss("BTCZAR", entry).toPlainString()).isEqualTo("98.00");
    }

    @Test
    void roundPrice_usesNearestTick() {
        assertThat(service.roundPrice("ETHZAR", new BigDecimal("50000.5")).toPlainString()).isEqualTo("50001");
        assertThat(service.roundPrice("ETHZAR", new BigDecimal("50000.49")).toPlainString()).isEqualTo("50000");
        assertThat(service.roundPrice("XRPZAR", new BigDecimal("10.123456")).toPlainString()).isEqualTo("10.1235");
    }

    @Test
    void roundPrice_fallsBackToDefaultPrecisionForUnknownPair() {
        assertThat(service.roundPrice("DOGEZAR", new BigDecimal("1.23456789")).toPlainString()).isEqualTo("1.234568");
    }

    @Test
    void quantityFor_roundsDown() {
        BigDecimal quantity = service.quantityFor("BTCZAR", new BigDecimal("100"), new BigDecimal("101.5"));

        assertThat(quantity.toPlainString()).isEqualTo("0.98522167");
        assertThat(service.roundQuantity("XRPZAR", new BigDecimal("12.999")).toPlainString()).isEqualTo("12.99");
    }

    @Test
    void inferEntryFromTakeProfit_invertsTakeProfitOffset() {
        BigDecimal takeProfit = service.protectiveTakeProfit("BTCZAR", new BigDecimal("200"));

        assertThat(service.inferEntryFromTakeProfit("BTCZAR", takeProfit)).isEqualByComparingTo("200");
    }

    @Test
    void realizedPnl_isSignedDifferenceTimesQuantity() {
        assertThat(service.realizedPnl(new BigDecimal("100"), new BigDecimal("98"), new BigDecimal("0.5")))
                .isEqualByComparingTo("-1");
    }

    @Test
    void requiredQuoteBalance_addsFeeAndSafetyMargin() {
        assertThat(service.requiredQuoteBalance(new BigDecimal("100"))).isEqualByComparingTo("100.6");
    }
}
