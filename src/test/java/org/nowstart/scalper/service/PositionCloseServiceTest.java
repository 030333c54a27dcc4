package org.nowstart.scalper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.scalper.data.dto.TradingStatusDto;
import org.nowstart.scalper.data.exception.ValrApiException;
import org.nowstart.scalper.data.exception.ValrConnectionException;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.data.type.CloseReason;
import org.nowstart.scalper.data.type.OrderRecordStatus;
import org.nowstart.scalper.data.type.PositionStatus;
import org.nowstart.scalper.repository.OrderRecordRepository;
import org.nowstart.scalper.repository.PositionRepository;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.support.MutableClock;
import org.nowstart.scalper.support.Positions;
import org.nowstart.scalper.support.TradingPropertiesFixture;

@ExtendWith(MockitoExtension.class)
class PositionCloseServiceTest {

    @Mock
    private ValrGateway valrGateway;
    @Mock
    private LiquidationService liquidationService;
    @Mock
    private TradingAuditService tradingAuditService;
    @Mock
    private PositionRepository positionRepository;
    @Mock
    private OrderRecordRepository orderRecordRepository;

    private MutableClock clock;
    private TradingStateService tradingStateService;
    private PositionCloseService service;
    private Position position;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        TradingProperties properties = TradingPropertiesFixture.defaults();
        tradingStateService = new TradingStateService(
                positionRepository, orderRecordRepository, properties, new TradingShutdownSignal(), clock);
        service = new PositionCloseService(
                valrGateway, liquidationService, new OrderPricingService(properties), tradingStateService, tradingAuditService);
        position = Positions.open("BTCZAR_1", clock.instant()).build();
        tradingStateService.openPosition(position);
    }

    @Test
    void forceClose_sellsResidualCappedByAvailableBalance() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.3")));
        when(liquidationService.liquidate("BTCZAR", new BigDecimal("0.3"), "exit_orders_missing"))
                .thenReturn(Optional.of("liq-1"));

        boolean closed = service.forceClose("BTCZAR_1", CloseReason.EXIT_ORDERS_MISSING);

        assertThat(closed).isTrue();
        assertThat(position.getStatus()).isEqualTo(PositionStatus.CLOSED);
        assertThat(tradingStateService.findPosition("BTCZAR_1")).isEmpty();
        verify(valrGateway).cancelOrder("BTCZAR", "tp-1");
        verify(valrGateway).cancelOrder("BTCZAR", "sl-1");
        verify(orderRecordRepository).updateStatus("tp-1", OrderRecordStatus.CANCELLED);
        verify(orderRecordRepository).updateStatus("sl-1", OrderRecordStatus.CANCELLED);
        verify(positionRepository).delete("BTCZAR_1");

        TradingStatusDto status = tradingStateService.status();
        assertThat(status.winsToday() + status.lossesToday()).isZero();
        assertThat(status.dailyPnl()).isEqualByComparingTo("0");
    }

    @Test
    void forceClose_isIdempotent() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.5")));
        when(liquidationService.liquidate(anyString(), any(), anyString())).thenReturn(Optional.of("liq-1"));
        service.forceClose("BTCZAR_1", CloseReason.BOTH_ORDERS_FILLED);

        boolean second = service.forceClose("BTCZAR_1", CloseReason.BOTH_ORDERS_FILLED);

        assertThat(second).isFalse();
        verify(valrGateway).getAccountBalances();
        verify(valrGateway).cancelOrder("BTCZAR", "tp-1");
        verify(valrGateway).cancelOrder("BTCZAR", "sl-1");
        verifyNoMoreInteractions(valrGateway);
    }

    @Test
    void forceClose_sellsFullQuantityWhenBalanceLookupFails() {
        when(valrGateway.getAccountBalances()).thenThrow(new ValrConnectionException("timeout", null));
        when(liquidationService.liquidate("BTCZAR", new BigDecimal("0.5"), "position_timeout"))
                .thenReturn(Optional.of("liq-1"));

        assertThat(service.forceClose("BTCZAR_1", CloseReason.POSITION_TIMEOUT)).isTrue();
    }

    @Test
    void forceClose_continuesWhenExitCancelIsRejected() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.5")));
        doThrow(new ValrApiException(400, "-5", "Order not found"))
                .when(valrGateway).cancelOrder(eq("BTCZAR"), anyString());
        when(liquidationService.liquidate(anyString(), any(), anyString())).thenReturn(Optional.of("liq-1"));

        assertThat(service.forceClose("BTCZAR_1", CloseReason.EXIT_ORDERS_TIMEOUT)).isTrue();
        verify(valrGateway).cancelOrder("BTCZAR", "sl-1");
    }

    @Test
    void forceClose_keepsPositionActiveWhenLiquidationThrows() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.5")));
        when(liquidationService.liquidate(anyString(), any(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.forceClose("BTCZAR_1", CloseReason.MANUAL))
                .isInstanceOf(IllegalStateException.class);

        assertThat(tradingStateService.findPosition("BTCZAR_1")).isPresent();
        assertThat(tradingStateService.beginClose("BTCZAR_1")).isPresent();
        verify(positionRepository, never()).delete(anyString());
    }

    @Test
    void closeOnExitFill_recordsRealizedPnl() {
        boolean closed = service.closeOnExitFill(
                "BTCZAR_1", CloseReason.TAKE_PROFIT, "tp-1", "sl-1", new BigDecimal("101.50"));

        assertThat(closed).isTrue();
        verify(valrGateway).cancelOrder("BTCZAR", "sl-1");
        verify(orderRecordRepository).updateStatus("sl-1", OrderRecordStatus.CANCELLED);
        verify(orderRecordRepository).updateStatus("tp-1", OrderRecordStatus.FILLED);
        TradingStatusDto status = tradingStateService.status();
        assertThat(status.winsToday()).isEqualTo(1);
        assertThat(status.dailyPnl()).isEqualByComparingTo("0.75");
        assertThat(status.openPositions()).isZero();
    }

    @Test
    void closeOnExitFill_countsStopLossAsLoss() {
        service.closeOnExitFill("BTCZAR_1", CloseReason.STOP_LOSS, "sl-1", "tp-1", new BigDecimal("98.00"));

        TradingStatusDto status = tradingStateService.status();
        assertThat(status.lossesToday()).isEqualTo(1);
        assertThat(status.dailyPnl()).isEqualByComparingTo("-1");
    }

    @Test
    void closeOnPartialExitFill_booksFilledPartAndSellsRemainder() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.5")));
        when(liquidationService.liquidate(
                eq("BTCZAR"), argThat(quantity -> quantity.compareTo(new BigDecimal("0.3")) == 0), eq("take_profit")))
                .thenReturn(Optional.of("liq-1"));

        boolean closed = service.closeOnPartialExitFill(
                "BTCZAR_1", CloseReason.TAKE_PROFIT, "tp-1", "sl-1", new BigDecimal("0.2"), new BigDecimal("101.50"));

        assertThat(closed).isTrue();
        verify(valrGateway).cancelOrder("BTCZAR", "sl-1");
        verify(valrGateway, never()).cancelOrder("BTCZAR", "tp-1");
        verify(orderRecordRepository).updateStatus("tp-1", OrderRecordStatus.CANCELLED);
        verify(positionRepository).delete("BTCZAR_1");
        TradingStatusDto status = tradingStateService.status();
        assertThat(status.winsToday()).isEqualTo(1);
        assertThat(status.dailyPnl()).isEqualByComparingTo("0.30");
        assertThat(status.openPositions()).isZero();
    }

    @Test
    void closeOnPartialExitFill_keepsPositionWhenRemainderSaleThrows() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.5")));
        when(liquidationService.liquidate(anyString(), any(), anyString()))
                .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.closeOnPartialExitFill(
                "BTCZAR_1", CloseReason.STOP_LOSS, "sl-1", "tp-1", new BigDecimal("0.2"), new BigDecimal("98.00")))
                .isInstanceOf(IllegalStateException.class);

        assertThat(tradingStateService.findPosition("BTCZAR_1")).isPresent();
        assertThat(tradingStateService.status().lossesToday()).isZero();
    }

    @Test
    void closeAtMarket_recordsPnlOnlyWhenSellIsAccepted() {
        when(valrGateway.getAccountBalances()).thenReturn(Map.of("BTC", new BigDecimal("0.5")));
        when(liquidationService.liquidate(anyString(), any(), anyString())).thenReturn(Optional.empty());

        boolean closed = service.closeAtMarket("BTCZAR_1", CloseReason.TAKE_PROFIT_MANUAL, new BigDecimal("101.60"));

        assertThat(closed).isTrue();
        assertThat(tradingStateService.status().winsToday()).isZero();
        assertThat(tradingStateService.findPosition("BTCZAR_1")).isEmpty();
    }

    @Test
    void closeAtMarket_returnsFalseForUnknownPosition() {
        assertThat(service.closeAtMarket("missing", CloseReason.TAKE_PROFIT_MANUAL, BigDecimal.TEN)).isFalse();
        assertThat(service.closeOnExitFill("missing", CloseReason.TAKE_PROFIT, "tp", null, BigDecimal.TEN)).isFalse();
    }
}
