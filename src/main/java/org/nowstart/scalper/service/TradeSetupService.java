package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.exception.TradingException;
import org.nowstart.scalper.data.model.EntryQuote;
import org.nowstart.scalper.data.model.FillOutcome;
import org.nowstart.scalper.data.model.OrderRecord;
import org.nowstart.scalper.data.model.PairSymbol;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.model.TradeSetupResult;
import org.nowstart.scalper.data.model.TradingSignal;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.data.type.ExchangeOrderStatus;
import org.nowstart.scalper.data.type.FillState;
import org.nowstart.scalper.data.type.NoTradeReason;
import org.nowstart.scalper.data.type.OrderRecordStatus;
import org.nowstart.scalper.data.type.OrderRole;
import org.nowstart.scalper.data.type.OrderSide;
import org.nowstart.scalper.data.type.PositionStatus;
import org.nowstart.scalper.data.type.ProtectionMode;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.service.entry.EntryPricingRegistry;
import org.springframework.stereotype.Service;

/**
 * Opens a position for a buy signal: entry order, fill wait, then protective exits. A filled entry
 * that cannot be protected is liquidated rather than left on the account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeSetupService {

    private final ValrGateway valrGateway;
    private final FillWaitService fillWaitService;
    private final OrderPricingService orderPricingService;
    private final EntryPricingRegistry entryPricingRegistry;
    private final LiquidationService liquidationService;
    private final TradingStateService tradingStateService;
    private final TradingAuditService tradingAuditService;
    private final TradingShutdownSignal tradingShutdownSignal;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public TradeSetupResult executeTradeSetup(String pair, TradingSignal signal) {
        if (tradingShutdownSignal.isShutdownRequested()) {
            return TradeSetupResult.noTrade(NoTradeReason.SHUTTING_DOWN, "shutdown requested");
        }
        if (tradingStateService.isDailyLimitReached()) {
            log.info("event=trade_skipped pair={} reason=daily_limit_reached max_daily_trades={}",
                    pair, tradingProperties.maxDailyTrades());
            return TradeSetupResult.noTrade(NoTradeReason.DAILY_LIMIT_REACHED, "daily trade limit reached");
        }
        if (tradingStateService.hasOpenPosition(pair)) {
            return TradeSetupResult.noTrade(NoTradeReason.POSITION_ALREADY_OPEN, "position already open for " + pair);
        }

        log.info("event=trade_setup_started pair={} source={} indicator={} confidence={}",
                pair, signal.source(), signal.indicatorValue(), signal.confidence());

        EntryQuote quote;
        String entryOrderId;
        try {
            OrderBookDto orderBook = valrGateway.getOrderBook(pair);
            if (orderBook.bestBid().isEmpty() || orderBook.bestAsk().isEmpty()) {
                log.warn("event=trade_skipped pair={} reason=no_market_data", pair);
                return TradeSetupResult.noTrade(NoTradeReason.NO_MARKET_DATA, "order book has an empty side");
            }

            Optional<EntryQuote> quoted = entryPricingRegistry.getRequired(tradingProperties.entryPricing())
                    .quote(pair, orderBook, tradingProperties.baseTradeAmount());
            if (quoted.isEmpty()) {
                return TradeSetupResult.noTrade(NoTradeReason.NO_MARKET_DATA, "no price for entry");
            }
            quote = quoted.get();
            if (quote.quantity().signum() <= 0) {
                log.warn("event=trade_skipped pair={} reason=invalid_quantity price={}", pair, quote.price());
                return TradeSetupResult.noTrade(NoTradeReason.INVALID_QUANTITY, "entry quantity rounds to zero");
            }

            String quoteCurrency = PairSymbol.parse(pair).quote();
            BigDecimal required = orderPricingService.requiredQuoteBalance(quote.notional());
            BigDecimal available = valrGateway.getAccountBalances().getOrDefault(quoteCurrency, BigDecimal.ZERO);
            if (available.compareTo(required) < 0) {
                log.warn("event=trade_skipped pair={} reason=insufficient_balance currency={} available={} required={}",
                        pair, quoteCurrency, available, required);
                return TradeSetupResult.noTrade(NoTradeReason.INSUFFICIENT_BALANCE,
                        "available " + available + " " + quoteCurrency + " < required " + required);
            }

            entryOrderId = placeEntry(pair, quote);
        } catch (ExchangeException e) {
            log.error("event=trade_setup_failed pair={} stage=entry", pair, e);
            return TradeSetupResult.noTrade(NoTradeReason.EXCHANGE_ERROR, e.getMessage());
        }

        trackOrder(entryOrderId, pair, OrderSide.BUY, quote.quantity(), quote.price(), OrderRole.ENTRY);

        FillOutcome outcome = fillWaitService.awaitFill(
                pair, entryOrderId, quote.quantity(), quote.price(), tradingProperties.entryFillTimeout());
        if (!outcome.hasFill() && outcome.state() != FillState.CANCELLED) {
            outcome = cancelUnfilledEntry(pair, entryOrderId, quote, outcome);
        }
        if (!outcome.hasFill()) {
            tradingStateService.updateOrder(entryOrderId, OrderRecordStatus.CANCELLED);
            NoTradeReason reason = outcome.state() == FillState.SHUTDOWN
                    ? NoTradeReason.SHUTTING_DOWN
                    : NoTradeReason.NOT_FILLED;
            log.info("event=trade_skipped pair={} reason={} order_id={} fill_state={}",
                    pair, reason, entryOrderId, outcome.state());
            return TradeSetupResult.noTrade(reason, "entry " + outcome.state().name().toLowerCase());
        }

        tradingStateService.updateOrder(entryOrderId, OrderRecordStatus.FILLED);
        return protect(pair, entryOrderId, outcome);
    }

    private String placeEntry(String pair, EntryQuote quote) {
        if (quote.market()) {
            return valrGateway.placeMarketOrder(pair, OrderSide.BUY, quote.notional());
        }
        return valrGateway.placeLimitOrder(pair, OrderSide.BUY, quote.quantity(), quote.price(), quote.postOnly());
    }

    /**
     * Cancels a resting entry and re-reads it once, since a fill can land between the last poll and
     * the cancel.
     */
    private FillOutcome cancelUnfilledEntry(String pair, String orderId, EntryQuote quote, FillOutcome outcome) {
        try {
            valrGateway.cancelOrder(pair, orderId);
        } catch (ExchangeException e) {
            log.warn("event=entry_cancel_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
        }

        try {
            OrderStatusDto status = valrGateway.getOrderStatus(pair, orderId);
            if (status.filledQuantity().signum() > 0) {
                BigDecimal price = status.averagePrice() != null ? status.averagePrice() : quote.price();
                log.warn("event=entry_filled_during_cancel pair={} order_id={} quantity={}",
                        pair, orderId, status.filledQuantity());
                return status.status() == ExchangeOrderStatus.FILLED
                        ? FillOutcome.filled(status.filledQuantity(), price)
                        : FillOutcome.partiallyFilled(status.filledQuantity(), price);
            }
        } catch (ExchangeException e) {
            log.warn("event=entry_recheck_failed pair={} order_id={} message={}", pair, orderId, e.getMessage());
        }
        return outcome;
    }

    private TradeSetupResult protect(String pair, String entryOrderId, FillOutcome outcome) {
        BigDecimal entryPrice = outcome.averagePrice();
        BigDecimal quantity = orderPricingService.roundQuantity(pair, outcome.filledQuantity());
        BigDecimal takeProfitPrice = orderPricingService.protectiveTakeProfit(pair, entryPrice);
        BigDecimal stopLossPrice = orderPricingService.protectiveStopLoss(pair, entryPrice);

        ProtectiveOrders protectiveOrders;
        try {
            protectiveOrders = placeProtectiveOrders(pair, quantity, entryPrice, takeProfitPrice, stopLossPrice);
        } catch (TradingException e) {
            return handleProtectionFailure(pair, entryOrderId, outcome.filledQuantity(), e);
        }

        Instant now = clock.instant();
        Position position = Position.builder()
                .id(pair + "_" + now.toEpochMilli())
                .pair(pair)
                .quantity(quantity)
                .entryPrice(entryPrice)
                .takeProfitPrice(takeProfitPrice)
                .stopLossPrice(stopLossPrice)
                .createdAt(now)
                .entryFilledAt(now)
                .status(PositionStatus.OPEN)
                .entryOrderId(entryOrderId)
                .takeProfitOrderId(protectiveOrders.takeProfitOrderId())
                .stopLossOrderId(protectiveOrders.stopLossOrderId())
                .build();

        tradingStateService.openPosition(position);
        tradingStateService.recordTrade();

        log.info(
                "event=position_opened position_id={} pair={} quantity={} entry_price={} take_profit={} stop_loss={} tp_order_id={} sl_order_id={}",
                position.getId(), pair, quantity, entryPrice, takeProfitPrice, stopLossPrice,
                position.getTakeProfitOrderId(), position.getStopLossOrderId()
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("quantity", quantity);
        details.put("entry_price", entryPrice);
        details.put("take_profit", takeProfitPrice);
        details.put("stop_loss", stopLossPrice);
        tradingAuditService.record("POSITION_OPENED", pair, position.getId(), details);
        return TradeSetupResult.opened(position);
    }

    private ProtectiveOrders placeProtectiveOrders(
            String pair,
            BigDecimal quantity,
            BigDecimal entryPrice,
            BigDecimal takeProfitPrice,
            BigDecimal stopLossPrice
    ) {
        if (quantity.signum() <= 0) {
            throw new TradingException("Filled quantity rounds to zero for " + pair, null);
        }
        if (stopLossPrice.compareTo(entryPrice) >= 0 || takeProfitPrice.compareTo(entryPrice) <= 0) {
            throw new TradingException("Exit prices collapse onto entry after tick rounding: stop_loss="
                    + stopLossPrice + " entry=" + entryPrice + " take_profit=" + takeProfitPrice, null);
        }

        String stopLossOrderId = null;
        try {
            stopLossOrderId = valrGateway.placeStopLimitOrder(pair, OrderSide.SELL, quantity, stopLossPrice, stopLossPrice);
            trackOrder(stopLossOrderId, pair, OrderSide.SELL, quantity, stopLossPrice, OrderRole.STOP_LOSS);

            String takeProfitOrderId = null;
            if (tradingProperties.protectionMode() == ProtectionMode.BOTH) {
                takeProfitOrderId = valrGateway.placeLimitOrder(pair, OrderSide.SELL, quantity, takeProfitPrice, true);
                trackOrder(takeProfitOrderId, pair, OrderSide.SELL, quantity, takeProfitPrice, OrderRole.TAKE_PROFIT);
            }
            return new ProtectiveOrders(takeProfitOrderId, stopLossOrderId);
        } catch (ExchangeException e) {
            if (stopLossOrderId != null) {
                cancelQuietly(pair, stopLossOrderId);
            }
            throw new TradingException("Failed to place protective orders for " + pair, e);
        }
    }

    private TradeSetupResult handleProtectionFailure(
            String pair,
            String entryOrderId,
            BigDecimal filledQuantity,
            TradingException failure
    ) {
        log.error("event=protection_failed pair={} entry_order_id={} quantity={}", pair, entryOrderId, filledQuantity, failure);

        Optional<String> liquidationOrderId = liquidationService.liquidate(pair, filledQuantity, "protection_failed");
        if (liquidationOrderId.isEmpty()) {
            log.error("event=unprotected_position pair={} entry_order_id={} quantity={} action=manual_intervention_required",
                    pair, entryOrderId, filledQuantity);
        }
        tradingStateService.recordFailedTrade();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entry_order_id", entryOrderId);
        details.put("quantity", filledQuantity);
        details.put("liquidated", liquidationOrderId.isPresent());
        details.put("error", failure.getMessage());
        tradingAuditService.record("PROTECTION_FAILED", pair, null, details);
        return TradeSetupResult.noTrade(NoTradeReason.PROTECTION_FAILED, failure.getMessage());
    }

    private void cancelQuietly(String pair, String orderId) {
        try {
            valrGateway.cancelOrder(pair, orderId);
            tradingStateService.updateOrder(orderId, OrderRecordStatus.CANCELLED);
        } catch (ExchangeException e) {
            log.error("event=protective_cancel_failed pair={} order_id={}", pair, orderId, e);
        }
    }

    private void trackOrder(String orderId, String pair, OrderSide side, BigDecimal quantity, BigDecimal price, OrderRole role) {
        Instant now = clock.instant();
        tradingStateService.trackOrder(OrderRecord.builder()
                .id(orderId)
                .pair(pair)
                .side(side)
                .quantity(quantity)
                .price(price)
                .role(role)
                .status(OrderRecordStatus.ACTIVE)
                .createdAt(now)
                .lastUpdated(now)
                .build());
    }

    private record ProtectiveOrders(String takeProfitOrderId, String stopLossOrderId) {
    }
}
