package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.FillDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.model.FillOutcome;
import org.nowstart.scalper.data.type.ExchangeOrderStatus;
import org.nowstart.scalper.data.type.FillState;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.repository.ValrResponseMapper;
import org.springframework.stereotype.Service;

/**
 * Polls an order until it reaches a terminal state, the timeout elapses or shutdown is requested.
 * Polling starts fast and slows down the longer the order rests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FillWaitService {

    private static final Duration FAST_PHASE = Duration.ofSeconds(10);
    private static final Duration MEDIUM_PHASE = Duration.ofSeconds(30);
    private static final Duration FAST_INTERVAL = Duration.ofMillis(500);
    private static final Duration MEDIUM_INTERVAL = Duration.ofSeconds(1);
    private static final Duration SLOW_INTERVAL = Duration.ofSeconds(2);

    private final ValrGateway valrGateway;
    private final TradingShutdownSignal tradingShutdownSignal;
    private final Sleeper sleeper;
    private final Clock clock;

    /**
     * @param submittedQuantity quantity sent with the order, used when the exchange reports a fill
     *                          without a quantity
     * @param referencePrice    limit price, or the reference ask for market orders
     */
    public FillOutcome awaitFill(
            String pair,
            String orderId,
            BigDecimal submittedQuantity,
            BigDecimal referencePrice,
            Duration timeout
    ) {
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(timeout);
        OrderStatusDto lastStatus = null;

        while (true) {
            if (tradingShutdownSignal.isShutdownRequested()) {
                log.warn("event=fill_wait_aborted reason=shutdown pair={} order_id={}", pair, orderId);
                return new FillOutcome(FillState.SHUTDOWN, filledQuantity(lastStatus), averagePrice(lastStatus));
            }

            try {
                lastStatus = valrGateway.getOrderStatus(pair, orderId);
            } catch (ExchangeException e) {
                log.warn("event=fill_wait_poll_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
            }

            if (lastStatus != null) {
                if (lastStatus.status() == ExchangeOrderStatus.FILLED) {
                    return resolveFilled(pair, orderId, lastStatus, submittedQuantity, referencePrice);
                }
                if (lastStatus.status() == ExchangeOrderStatus.CANCELLED) {
                    return resolveCancelled(pair, orderId, lastStatus, referencePrice);
                }
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                break;
            }
            Duration remaining = Duration.between(now, deadline);
            Duration interval = pollInterval(Duration.between(startedAt, now));
            sleeper.sleep(interval.compareTo(remaining) < 0 ? interval : remaining);
        }

        return resolveTimeout(pair, orderId, lastStatus, referencePrice, timeout);
    }

    static Duration pollInterval(Duration elapsed) {
        if (elapsed.compareTo(FAST_PHASE) < 0) {
            return FAST_INTERVAL;
        }
        if (elapsed.compareTo(MEDIUM_PHASE) < 0) {
            return MEDIUM_INTERVAL;
        }
        return SLOW_INTERVAL;
    }

    private FillOutcome resolveFilled(
            String pair,
            String orderId,
            OrderStatusDto status,
            BigDecimal submittedQuantity,
            BigDecimal referencePrice
    ) {
        BigDecimal quantity = status.filledQuantity();
        BigDecimal price = status.averagePrice();

        if (quantity.signum() <= 0 || price == null) {
            List<FillDto> fills = fetchFills(pair, orderId);
            if (quantity.signum() <= 0) {
                quantity = fills.stream().map(FillDto::quantity).reduce(BigDecimal.ZERO, BigDecimal::add);
            }
            if (price == null) {
                price = ValrResponseMapper.volumeWeightedPrice(fills);
            }
        }
        if (quantity.signum() <= 0) {
            log.warn("event=fill_quantity_fallback pair={} order_id={} submitted_quantity={}",
                    pair, orderId, submittedQuantity);
            quantity = submittedQuantity;
        }
        if (price == null) {
            price = referencePrice;
        }

        log.info("event=order_filled pair={} order_id={} quantity={} average_price={}", pair, orderId, quantity, price);
        return FillOutcome.filled(quantity, price);
    }

    private FillOutcome resolveCancelled(String pair, String orderId, OrderStatusDto status, BigDecimal referencePrice) {
        BigDecimal quantity = status.filledQuantity();
        if (quantity.signum() > 0) {
            BigDecimal price = status.averagePrice() != null ? status.averagePrice() : referencePrice;
            log.warn("event=order_cancelled_with_fill pair={} order_id={} quantity={} raw_status={}",
                    pair, orderId, quantity, status.rawStatus());
            return FillOutcome.partiallyFilled(quantity, price);
        }
        log.info("event=order_cancelled_unfilled pair={} order_id={} raw_status={}", pair, orderId, status.rawStatus());
        return FillOutcome.unfilled(FillState.CANCELLED);
    }

    private FillOutcome resolveTimeout(
            String pair,
            String orderId,
            OrderStatusDto lastStatus,
            BigDecimal referencePrice,
            Duration timeout
    ) {
        BigDecimal quantity = filledQuantity(lastStatus);
        if (quantity.signum() <= 0) {
            log.info("event=fill_wait_timeout pair={} order_id={} timeout_ms={}", pair, orderId, timeout.toMillis());
            return FillOutcome.unfilled(FillState.TIMEOUT);
        }

        try {
            valrGateway.cancelOrder(pair, orderId);
        } catch (ExchangeException e) {
            log.warn("event=partial_remainder_cancel_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
        }

        // 마지막 폴링 이후 취소 전까지 들어온 체결을 반영한다
        OrderStatusDto settled = lastStatus;
        OrderStatusDto afterCancel = readStatusAfterCancel(pair, orderId);
        if (afterCancel != null && afterCancel.filledQuantity() != null
                && afterCancel.filledQuantity().compareTo(quantity) > 0) {
            log.info("event=fill_grew_during_cancel pair={} order_id={} polled_quantity={} settled_quantity={}",
                    pair, orderId, quantity, afterCancel.filledQuantity());
            settled = afterCancel;
            quantity = afterCancel.filledQuantity();
        }

        BigDecimal price = settled.averagePrice() != null ? settled.averagePrice() : referencePrice;
        if (settled.status() == ExchangeOrderStatus.FILLED) {
            log.info("event=order_filled pair={} order_id={} quantity={} average_price={}", pair, orderId, quantity, price);
            return FillOutcome.filled(quantity, price);
        }
        log.info("event=fill_wait_partial pair={} order_id={} quantity={} average_price={}", pair, orderId, quantity, price);
        return FillOutcome.partiallyFilled(quantity, price);
    }

    private OrderStatusDto readStatusAfterCancel(String pair, String orderId) {
        try {
            return valrGateway.getOrderStatus(pair, orderId);
        } catch (ExchangeException e) {
            log.warn("event=post_cancel_status_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
            return null;
        }
    }

    private List<FillDto> fetchFills(String pair, String orderId) {
        try {
            return valrGateway.getOrderFills(pair, orderId);
        } catch (ExchangeException e) {
            log.warn("event=fill_lookup_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
            return List.of();
        }
    }

    private BigDecimal filledQuantity(OrderStatusDto status) {
        return status == null ? BigDecimal.ZERO : status.filledQuantity();
    }

    private BigDecimal averagePrice(OrderStatusDto status) {
        return status == null ? null : status.averagePrice();
    }
}
