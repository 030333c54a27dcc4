package org.nowstart.scalper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.scalper.data.dto.FillDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.exception.ValrConnectionException;
import org.nowstart.scalper.data.model.FillOutcome;
import org.nowstart.scalper.data.type.ExchangeOrderStatus;
import org.nowstart.scalper.data.type.FillState;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.support.MutableClock;

@ExtendWith(MockitoExtension.class)
class FillWaitServiceTest {

    private static final BigDecimal SUBMITTED = new BigDecimal("0.5");
    private static final BigDecimal REFERENCE = new BigDecimal("100");

    @Mock
    private ValrGateway valrGateway;

    private MutableClock clock;
    private TradingShutdownSignal shutdownSignal;
    private FillWaitService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        shutdownSignal = new TradingShutdownSignal();
        service = new FillWaitService(valrGateway, shutdownSignal, clock.sleeper(), clock);
    }

    @Test
    void awaitFill_returnsReportedFill() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1"))
                .thenReturn(status(ExchangeOrderStatus.PENDING, "0", null))
                .thenReturn(status(ExchangeOrderStatus.FILLED, "0.5", "99.9"));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.state()).isEqualTo(FillState.FILLED);
        assertThat(outcome.filledQuantity()).isEqualByComparingTo("0.5");
        assertThat(outcome.averagePrice()).isEqualByComparingTo("99.9");
        verify(valrGateway, never()).getOrderFills(anyString(), anyString());
    }

    @Test
    void awaitFill_readsFillsWhenFilledStatusLacksQuantity() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1")).thenReturn(status(ExchangeOrderStatus.FILLED, "0", null));
        when(valrGateway.getOrderFills("BTCZAR", "o-1")).thenReturn(List.of(
                new FillDto("o-1", new BigDecimal("100"), new BigDecimal("0.2")),
                new FillDto("o-1", new BigDecimal("102"), new BigDecimal("0.2"))
        ));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.filledQuantity()).isEqualByComparingTo("0.4");
        assertThat(outcome.averagePrice()).isEqualByComparingTo("101");
    }

    @Test
    void awaitFill_fallsBackToSubmittedQuantityWhenFillsAreUnavailable() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1")).thenReturn(status(ExchangeOrderStatus.FILLED, "0", null));
        when(valrGateway.getOrderFills("BTCZAR", "o-1")).thenThrow(new ValrConnectionException("down", null));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.hasFill()).isTrue();
        assertThat(outcome.filledQuantity()).isEqualByComparingTo(SUBMITTED);
        assertThat(outcome.averagePrice()).isEqualByComparingTo(REFERENCE);
    }

    @Test
    void awaitFill_timesOutWithoutFill() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1")).thenReturn(status(ExchangeOrderStatus.PENDING, "0", null));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(5));

        assertThat(outcome.state()).isEqualTo(FillState.TIMEOUT);
        assertThat(outcome.hasFill()).isFalse();
        assertThat(clock.instant()).isEqualTo("2026-03-01T10:00:05Z");
        verify(valrGateway, atLeast(2)).getOrderStatus("BTCZAR", "o-1");
        verify(valrGateway, never()).cancelOrder(anyString(), anyString());
    }

    @Test
    void awaitFill_cancelsRemainderOfPartialFillAtTimeout() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1"))
                .thenReturn(status(ExchangeOrderStatus.PARTIALLY_FILLED, "0.2", "100.1"));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(3));

        assertThat(outcome.state()).isEqualTo(FillState.PARTIALLY_FILLED);
        assertThat(outcome.filledQuantity()).isEqualByComparingTo("0.2");
        assertThat(outcome.averagePrice()).isEqualByComparingTo("100.1");
        verify(valrGateway).cancelOrder("BTCZAR", "o-1");
    }

    @Test
    void awaitFill_countsFillsThatArriveWhileCancellingRemainder() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1"))
                .thenReturn(status(ExchangeOrderStatus.PARTIALLY_FILLED, "0.2", "100.1"))
                .thenReturn(status(ExchangeOrderStatus.PARTIALLY_FILLED, "0.2", "100.1"))
                .thenReturn(status(ExchangeOrderStatus.CANCELLED, "0.6", "100.05"));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofMillis(500));

        assertThat(outcome.state()).isEqualTo(FillState.PARTIALLY_FILLED);
        assertThat(outcome.filledQuantity()).isEqualByComparingTo("0.6");
        assertThat(outcome.averagePrice()).isEqualByComparingTo("100.05");
        verify(valrGateway).cancelOrder("BTCZAR", "o-1");
    }

    @Test
    void awaitFill_treatsCancelledWithFillAsPartial() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1")).thenReturn(status(ExchangeOrderStatus.CANCELLED, "0.1", null));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.state()).isEqualTo(FillState.PARTIALLY_FILLED);
        assertThat(outcome.averagePrice()).isEqualByComparingTo(REFERENCE);
    }

    @Test
    void awaitFill_returnsCancelledWhenNothingFilled() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1")).thenReturn(status(ExchangeOrderStatus.CANCELLED, "0", null));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.state()).isEqualTo(FillState.CANCELLED);
    }

    @Test
    void awaitFill_keepsPollingAfterTransientError() {
        when(valrGateway.getOrderStatus("BTCZAR", "o-1"))
                .thenThrow(new ValrConnectionException("reset", null))
                .thenReturn(status(ExchangeOrderStatus.FILLED, "0.5", "100"));

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.state()).isEqualTo(FillState.FILLED);
    }

    @Test
    void awaitFill_stopsOnShutdown() {
        shutdownSignal.requestShutdown();

        FillOutcome outcome = service.awaitFill("BTCZAR", "o-1", SUBMITTED, REFERENCE, Duration.ofSeconds(60));

        assertThat(outcome.state()).isEqualTo(FillState.SHUTDOWN);
        verifyNoInteractions(valrGateway);
    }

    @Test
    void pollInterval_slowsDownOverTime() {
        assertThat(FillWaitService.pollInterval(Duration.ofSeconds(1))).isEqualTo(Duration.ofMillis(500));
        assertThat(FillWaitService.pollInterval(Duration.ofSeconds(15))).isEqualTo(Duration.ofSeconds(1));
        assertThat(FillWaitService.pollInterval(Duration.ofSeconds(45))).isEqualTo(Duration.ofSeconds(2));
    }

    private OrderStatusDto status(ExchangeOrderStatus status, String filled, String averagePrice) {
        return new OrderStatusDto(
                "o-1",
                status,
                status.name(),
                SUBMITTED,
                new BigDecimal(filled),
                averagePrice == null ? null : new BigDecimal(averagePrice)
        );
    }
}
