package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.model.PairSymbol;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.type.CloseReason;
import org.nowstart.scalper.data.type.OrderRecordStatus;
import org.nowstart.scalper.repository.ValrGateway;
import org.springframework.stereotype.Service;

/**
 * Every way a position leaves the active set. Each path claims the position first, so a second
 * close of the same position makes no exchange calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionCloseService {

    private final ValrGateway valrGateway;
    private final LiquidationService liquidationService;
    private final OrderPricingService orderPricingService;
    private final TradingStateService tradingStateService;
    private final TradingAuditService tradingAuditService;

    /**
     * Cancels the exit orders and market-sells whatever quantity is still held. PnL is not
     * attributed.
     *
     * @return false when the position was not active
     */
    public boolean forceClose(String positionId, CloseReason reason) {
        Optional<Position> claimed = tradingStateService.beginClose(positionId);
        if (claimed.isEmpty()) {
            log.debug("event=force_close_skipped position_id={} reason={} detail=not_active", positionId, reason.code());
            return false;
        }

        Position position = claimed.get();
        Optional<String> liquidationOrderId = Optional.empty();
        BigDecimal residual = BigDecimal.ZERO;
        try {
            cancelExitOrders(position);
            residual = residualQuantity(position, position.getQuantity());
            liquidationOrderId = liquidationService.liquidate(position.getPair(), residual, reason.code());
        } catch (RuntimeException e) {
            tradingStateService.abortClose(position.getId());
            throw e;
        }
        tradingStateService.completeClose(position);

        log.warn("event=position_force_closed position_id={} pair={} reason={} residual_quantity={} sell_order_id={}",
                position.getId(), position.getPair(), reason.code(), residual, liquidationOrderId.orElse("none"));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.code());
        details.put("residual_quantity", residual);
        details.put("sell_order_id", liquidationOrderId.orElse("none"));
        tradingAuditService.record("POSITION_FORCE_CLOSED", position.getPair(), position.getId(), details);
        return true;
    }

    /**
     * Closes a position whose take-profit or stop-loss order filled on the exchange.
     *
     * @param filledOrderId    the exit order that filled
     * @param remainingOrderId the opposite exit order, cancelled here; may be null
     */
    public boolean closeOnExitFill(
            String positionId,
            CloseReason reason,
            String filledOrderId,
            String remainingOrderId,
            BigDecimal exitPrice
    ) {
        Optional<Position> claimed = tradingStateService.beginClose(positionId);
        if (claimed.isEmpty()) {
            return false;
        }

        Position position = claimed.get();
        BigDecimal pnl = orderPricingService.realizedPnl(position.getEntryPrice(), exitPrice, position.getQuantity());
        try {
            if (remainingOrderId != null) {
                cancelExitOrder(position.getPair(), remainingOrderId);
            }
            tradingStateService.updateOrder(filledOrderId, OrderRecordStatus.FILLED);
        } catch (RuntimeException e) {
            tradingStateService.abortClose(position.getId());
            throw e;
        }
        tradingStateService.recordExit(pnl);
        tradingStateService.completeClose(position);

        logClosed(position, reason, exitPrice, pnl);
        return true;
    }

    /**
     * Closes a position whose exit order was cancelled after filling only part of the quantity. PnL
     * is booked on the filled part and the unfilled remainder is sold.
     *
     * @param filledQuantity quantity the exit order filled before it was cancelled
     */
    public boolean closeOnPartialExitFill(
            String positionId,
            CloseReason reason,
            String partialOrderId,
            String remainingOrderId,
            BigDecimal filledQuantity,
            BigDecimal exitPrice
    ) {
        Optional<Position> claimed = tradingStateService.beginClose(positionId);
        if (claimed.isEmpty()) {
            return false;
        }

        Position position = claimed.get();
        BigDecimal pnl = orderPricingService.realizedPnl(position.getEntryPrice(), exitPrice, filledQuantity);
        BigDecimal residual;
        Optional<String> sellOrderId;
        try {
            if (remainingOrderId != null) {
                cancelExitOrder(position.getPair(), remainingOrderId);
            }
            tradingStateService.updateOrder(partialOrderId, OrderRecordStatus.CANCELLED);
            residual = residualQuantity(position, position.getQuantity().subtract(filledQuantity).max(BigDecimal.ZERO));
            sellOrderId = liquidationService.liquidate(position.getPair(), residual, reason.code());
        } catch (RuntimeException e) {
            tradingStateService.abortClose(position.getId());
            throw e;
        }
        if (sellOrderId.isEmpty() && orderPricingService.roundQuantity(position.getPair(), residual).signum() > 0) {
            log.error("event=unprotected_position position_id={} pair={} quantity={} action=manual_intervention_required",
                    position.getId(), position.getPair(), residual);
        }
        tradingStateService.recordExit(pnl);
        tradingStateService.completeClose(position);

        log.warn("event=exit_order_partially_filled position_id={} pair={} order_id={} filled_quantity={} residual_quantity={} sell_order_id={}",
                position.getId(), position.getPair(), partialOrderId, filledQuantity, residual, sellOrderId.orElse("none"));
        logClosed(position, reason, exitPrice, pnl);
        return true;
    }

    /**
     * Takes profit at market when only a stop-loss rests on the book and the bid reached the target.
     */
    public boolean closeAtMarket(String positionId, CloseReason reason, BigDecimal referencePrice) {
        Optional<Position> claimed = tradingStateService.beginClose(positionId);
        if (claimed.isEmpty()) {
            return false;
        }

        Position position = claimed.get();
        BigDecimal pnl = orderPricingService.realizedPnl(position.getEntryPrice(), referencePrice, position.getQuantity());
        try {
            cancelExitOrders(position);
            Optional<String> sellOrderId = liquidationService.liquidate(
                    position.getPair(), residualQuantity(position, position.getQuantity()), reason.code());
            if (sellOrderId.isPresent()) {
                tradingStateService.recordExit(pnl);
            } else {
                log.error("event=unprotected_position position_id={} pair={} quantity={} action=manual_intervention_required",
                        position.getId(), position.getPair(), position.getQuantity());
            }
        } catch (RuntimeException e) {
            tradingStateService.abortClose(position.getId());
            throw e;
        }
        tradingStateService.completeClose(position);

        logClosed(position, reason, referencePrice, pnl);
        return true;
    }

    private void logClosed(Position position, CloseReason reason, BigDecimal exitPrice, BigDecimal pnl) {
        log.info("event=position_closed position_id={} pair={} reason={} entry_price={} exit_price={} quantity={} pnl={}",
                position.getId(), position.getPair(), reason.code(), position.getEntryPrice(), exitPrice,
                position.getQuantity(), pnl);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.code());
        details.put("exit_price", exitPrice);
        details.put("pnl", pnl);
        tradingAuditService.record("POSITION_CLOSED", position.getPair(), position.getId(), details);
    }

    private void cancelExitOrders(Position position) {
        if (position.getTakeProfitOrderId() != null) {
            cancelExitOrder(position.getPair(), position.getTakeProfitOrderId());
        }
        if (position.getStopLossOrderId() != null) {
            cancelExitOrder(position.getPair(), position.getStopLossOrderId());
        }
    }

    private void cancelExitOrder(String pair, String orderId) {
        try {
            valrGateway.cancelOrder(pair, orderId);
        } catch (ExchangeException e) {
            // 이미 체결되었거나 취소된 주문이면 실패가 정상이다
            log.warn("event=exit_order_cancel_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
        }
        tradingStateService.updateOrder(orderId, OrderRecordStatus.CANCELLED);
    }

    /**
     * The held quantity capped by the available base balance. Falls back to the held quantity when
     * the balance cannot be read.
     */
    private BigDecimal residualQuantity(Position position, BigDecimal heldQuantity) {
        String baseCurrency = PairSymbol.parse(position.getPair()).base();
        try {
            BigDecimal available = valrGateway.getAccountBalances().getOrDefault(baseCurrency, BigDecimal.ZERO);
            return heldQuantity.min(available);
        } catch (ExchangeException e) {
            log.warn("event=residual_balance_lookup_failed position_id={} currency={} message={}",
                    position.getId(), baseCurrency, e.getMessage());
            return heldQuantity;
        }
    }
}
