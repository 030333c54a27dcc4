package org.nowstart.scalper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.dto.PriceLevel;
import org.nowstart.scalper.data.exception.ValrApiException;
import org.nowstart.scalper.data.exception.ValrConnectionException;
import org.nowstart.scalper.data.type.OrderSide;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.support.TradingPropertiesFixture;

@ExtendWith(MockitoExtension.class)
class LiquidationServiceTest {

    @Mock
    private ValrGateway valrGateway;

    @Test
    void liquidate_sellsAtMarketWithRoundedQuantity() {
        LiquidationService service = createService();
        when(valrGateway.placeMarketOrder("BTCZAR", OrderSide.SELL, new BigDecimal("0.12345678"))).thenReturn("m-1");

        assertThat(service.liquidate("BTCZAR", new BigDecimal("0.123456789"), "manual")).contains("m-1");
    }

    @Test
    void liquidate_fallsBackToLimitAtBestBid() {
        LiquidationService service = createService();
        when(valrGateway.placeMarketOrder("BTCZAR", OrderSide.SELL, new BigDecimal("0.50000000")))
                .thenThrow(new ValrApiException(400, "-1", "Market orders disabled"));
        when(valrGateway.getOrderBook("BTCZAR")).thenReturn(new OrderBookDto(
                "BTCZAR",
                List.of(new PriceLevel(new BigDecimal("99.954"), BigDecimal.ONE)),
                List.of()
        ));
        when(valrGateway.placeLimitOrder("BTCZAR", OrderSide.SELL, new BigDecimal("0.50000000"), new BigDecimal("99.95"), false))
                .thenReturn("l-1");

        assertThat(service.liquidate("BTCZAR", new BigDecimal("0.5"), "protection_failed")).contains("l-1");
    }

    @Test
    void liquidate_returnsEmptyWhenBothAttemptsFail() {
        LiquidationService service = createService();
        when(valrGateway.placeMarketOrder("BTCZAR", OrderSide.SELL, new BigDecimal("0.50000000")))
                .thenThrow(new ValrConnectionException("down", null));
        when(valrGateway.getOrderBook("BTCZAR")).thenThrow(new ValrConnectionException("down", null));

        assertThat(service.liquidate("BTCZAR", new BigDecimal("0.5"), "manual")).isEmpty();
    }

    @Test
    void liquidate_skipsDustQuantity() {
        LiquidationService service = createService();

        assertThat(service.liquidate("BTCZAR", new BigDecimal("0.000000001"), "manual")).isEmpty();
        verifyNoInteractions(valrGateway);
    }

    @Test
    void liquidate_returnsEmptyWithoutBids() {
        LiquidationService service = createService();
        when(valrGateway.placeMarketOrder("BTCZAR", OrderSide.SELL, new BigDecimal("0.50000000")))
                .thenThrow(new ValrConnectionException("down", null));
        when(valrGateway.getOrderBook("BTCZAR")).thenReturn(new OrderBookDto("BTCZAR", List.of(), List.of()));

        assertThat(service.liquidate("BTCZAR", new BigDecimal("0.5"), "manual")).isEmpty();
        verify(valrGateway).getOrderBook("BTCZAR");
    }

    private LiquidationService createService() {
        return new LiquidationService(valrGateway, new OrderPricingService(TradingPropertiesFixture.defaults()));
    }
}
