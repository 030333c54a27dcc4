package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.OpenOrderDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.dto.PriceLevel;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.data.type.CloseReason;
import org.nowstart.scalper.data.type.ExchangeOrderStatus;
import org.nowstart.scalper.repository.ValrGateway;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PositionMonitorService {

    private final ValrGateway valrGateway;
    private final PositionCloseService positionCloseService;
    private final TradingStateService tradingStateService;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public void monitorPositions() {
        List<Position> positions = tradingStateService.openPositions();
        if (positions.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        List<OpenOrderDto> openOrders = null;
        for (Position position : positions) {
            try {
                if (closeIfExpired(position, now)) {
                    continue;
                }
                if (openOrders == null) {
                    openOrders = valrGateway.getOpenOrders();
                }
                evaluate(position, openOrders);
            } catch (Exception e) {
                log.error("event=position_monitor_failed position_id={} pair={}", position.getId(), position.getPair(), e);
            }
        }
    }

    private boolean closeIfExpired(Position position, Instant now) {
        Instant filledAt = position.getEntryFilledAt();
        if (now.isAfter(filledAt.plus(tradingProperties.positionTimeout()))) {
            log.warn("event=position_timeout position_id={} pair={} entry_filled_at={}",
                    position.getId(), position.getPair(), filledAt);
            positionCloseService.forceClose(position.getId(), CloseReason.POSITION_TIMEOUT);
            return true;
        }
        if (now.isAfter(filledAt.plus(tradingProperties.exitOrderTimeout()))) {
            log.warn("event=exit_orders_timeout position_id={} pair={} entry_filled_at={}",
                    position.getId(), position.getPair(), filledAt);
            positionCloseService.forceClose(position.getId(), CloseReason.EXIT_ORDERS_TIMEOUT);
            return true;
        }
        return false;
    }

    private void evaluate(Position position, List<OpenOrderDto> openOrders) {
        Set<String> openIds = openOrders.stream()
                .filter(order -> order.pair() == null || order.pair().equals(position.getPair()))
                .map(OpenOrderDto::orderId)
                .collect(Collectors.toSet());

        String takeProfitOrderId = position.getTakeProfitOrderId();
        String stopLossOrderId = position.getStopLossOrderId();
        boolean takeProfitOpen = takeProfitOrderId != null && openIds.contains(takeProfitOrderId);
        boolean stopLossOpen = stopLossOrderId != null && openIds.contains(stopLossOrderId);

        if (!takeProfitOpen && !stopLossOpen) {
            resolveAllExitsMissing(position);
            return;
        }

        if (takeProfitOrderId == null) {
            watchManualTakeProfit(position);
            return;
        }

        if (takeProfitOpen != stopLossOpen) {
            boolean takeProfitGone = !takeProfitOpen;
            attributeMissingExit(
                    position,
                    takeProfitGone ? CloseReason.TAKE_PROFIT : CloseReason.STOP_LOSS,
                    takeProfitGone ? takeProfitOrderId : stopLossOrderId,
                    takeProfitGone ? stopLossOrderId : takeProfitOrderId,
                    takeProfitGone ? position.getTakeProfitPrice() : position.getStopLossPrice()
            );
            return;
        }

        checkExitFills(position);
    }

    /**
     * Both exit orders are still listed. Read both statuses before acting on either so a double fill
     * is never attributed to one side.
     */
    private void checkExitFills(Position position) {
        OrderStatusDto takeProfit = valrGateway.getOrderStatus(position.getPair(), position.getTakeProfitOrderId());
        OrderStatusDto stopLoss = valrGateway.getOrderStatus(position.getPair(), position.getStopLossOrderId());
        boolean takeProfitFilled = takeProfit.status() == ExchangeOrderStatus.FILLED;
        boolean stopLossFilled = stopLoss.status() == ExchangeOrderStatus.FILLED;

        if (takeProfitFilled && stopLossFilled) {
            log.error("event=both_exit_orders_filled position_id={} pair={} tp_order_id={} sl_order_id={}",
                    position.getId(), position.getPair(), takeProfit.orderId(), stopLoss.orderId());
            positionCloseService.forceClose(position.getId(), CloseReason.BOTH_ORDERS_FILLED);
            return;
        }
        if (takeProfitFilled) {
            positionCloseService.closeOnExitFill(
                    position.getId(), CloseReason.TAKE_PROFIT,
                    position.getTakeProfitOrderId(), position.getStopLossOrderId(),
                    exitPrice(takeProfit, position.getTakeProfitPrice()));
            return;
        }
        if (stopLossFilled) {
            positionCloseService.closeOnExitFill(
                    position.getId(), CloseReason.STOP_LOSS,
                    position.getStopLossOrderId(), position.getTakeProfitOrderId(),
                    exitPrice(stopLoss, position.getStopLossPrice()));
        }
    }

    private void attributeMissingExit(
            Position position,
            CloseReason reason,
            String missingOrderId,
            String remainingOrderId,
            BigDecimal plannedPrice
    ) {
        OrderStatusDto status = lookupStatus(position, missingOrderId);

        if (status != null && status.status() == ExchangeOrderStatus.CANCELLED && status.filledQuantity().signum() <= 0) {
            log.warn("event=exit_order_cancelled position_id={} order_id={} raw_status={}",
                    position.getId(), missingOrderId, status.rawStatus());
            positionCloseService.forceClose(position.getId(), CloseReason.EXIT_ORDER_CANCELLED);
            return;
        }

        closeOnExit(position, reason, missingOrderId, remainingOrderId, status, plannedPrice);
    }

    /**
     * No exit order is listed any more. A filled exit is closed at its price; otherwise the position
     * has lost its protection and is force-closed.
     */
    private void resolveAllExitsMissing(Position position) {
        String takeProfitOrderId = position.getTakeProfitOrderId();
        String stopLossOrderId = position.getStopLossOrderId();
        OrderStatusDto takeProfit = lookupStatus(position, takeProfitOrderId);
        OrderStatusDto stopLoss = lookupStatus(position, stopLossOrderId);
        boolean takeProfitFilled = hasFill(takeProfit);
        boolean stopLossFilled = hasFill(stopLoss);

        if (takeProfitFilled && stopLossFilled) {
            log.error("event=both_exit_orders_filled position_id={} pair={} tp_order_id={} sl_order_id={}",
                    position.getId(), position.getPair(), takeProfitOrderId, stopLossOrderId);
            positionCloseService.forceClose(position.getId(), CloseReason.BOTH_ORDERS_FILLED);
            return;
        }
        if (takeProfitFilled) {
            closeOnExit(position, CloseReason.TAKE_PROFIT, takeProfitOrderId, stopLossOrderId,
                    takeProfit, position.getTakeProfitPrice());
            return;
        }
        if (stopLossFilled) {
            closeOnExit(position, CloseReason.STOP_LOSS, stopLossOrderId, takeProfitOrderId,
                    stopLoss, position.getStopLossPrice());
            return;
        }

        log.warn("event=exit_orders_missing position_id={} pair={} tp_order_id={} sl_order_id={}",
                position.getId(), position.getPair(), takeProfitOrderId, stopLossOrderId);
        positionCloseService.forceClose(position.getId(), CloseReason.EXIT_ORDERS_MISSING);
    }

    /**
     * An exit order cancelled short of the position quantity leaves a remainder to sell.
     */
    private void closeOnExit(
            Position position,
            CloseReason reason,
            String exitOrderId,
            String otherOrderId,
            OrderStatusDto status,
            BigDecimal plannedPrice
    ) {
        BigDecimal price = exitPrice(status, plannedPrice);
        if (status != null
                && status.status() != ExchangeOrderStatus.FILLED
                && status.filledQuantity() != null
                && status.filledQuantity().signum() > 0
                && status.filledQuantity().compareTo(position.getQuantity()) < 0) {
            positionCloseService.closeOnPartialExitFill(
                    position.getId(), reason, exitOrderId, otherOrderId, status.filledQuantity(), price);
            return;
        }
        positionCloseService.closeOnExitFill(position.getId(), reason, exitOrderId, otherOrderId, price);
    }

    private OrderStatusDto lookupStatus(Position position, String orderId) {
        if (orderId == null) {
            return null;
        }
        try {
            return valrGateway.getOrderStatus(position.getPair(), orderId);
        } catch (ExchangeException e) {
            log.warn("event=exit_status_lookup_failed position_id={} order_id={} message={}",
                    position.getId(), orderId, e.getMessage());
            return null;
        }
    }

    private boolean hasFill(OrderStatusDto status) {
        if (status == null) {
            return false;
        }
        return status.status() == ExchangeOrderStatus.FILLED
                || (status.filledQuantity() != null && status.filledQuantity().signum() > 0);
    }

    private void watchManualTakeProfit(Position position) {
        Optional<PriceLevel> bestBid = valrGateway.getOrderBook(position.getPair()).bestBid();
        if (bestBid.isEmpty() || bestBid.get().price().compareTo(position.getTakeProfitPrice()) < 0) {
            return;
        }

        log.info("event=manual_take_profit_triggered position_id={} pair={} best_bid={} take_profit={}",
                position.getId(), position.getPair(), bestBid.get().price(), position.getTakeProfitPrice());
        positionCloseService.closeAtMarket(position.getId(), CloseReason.TAKE_PROFIT_MANUAL, bestBid.get().price());
    }

    private BigDecimal exitPrice(OrderStatusDto status, BigDecimal plannedPrice) {
        if (status != null && status.averagePrice() != null) {
            return status.averagePrice();
        }
        return plannedPrice;
    }
}
