package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.PriceLevel;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.type.OrderSide;
import org.nowstart.scalper.repository.ValrGateway;
import org.springframework.stereotype.Service;

/**
 * Sells a base quantity as fast as possible: market order first, then a limit at the best bid.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidationService {

    private final ValrGateway valrGateway;
    private final OrderPricingService orderPricingService;

    /**
     * @return the id of the accepted sell order, empty when both attempts failed
     */
    public Optional<String> liquidate(String pair, BigDecimal quantity, String reason) {
        BigDecimal sellQuantity = orderPricingService.roundQuantity(pair, quantity);
        if (sellQuantity.signum() <= 0) {
            log.info("event=liquidation_skipped pair={} quantity={} reason={}", pair, quantity, reason);
            return Optional.empty();
        }

        try {
            String orderId = valrGateway.placeMarketOrder(pair, OrderSide.SELL, sellQuantity);
            log.info("event=liquidation_sent type=market pair={} quantity={} reason={} order_id={}",
                    pair, sellQuantity, reason, orderId);
            return Optional.of(orderId);
        } catch (ExchangeException e) {
            log.warn("event=liquidation_market_failed pair={} quantity={} reason={} message={}",
                    pair, sellQuantity, reason, e.getMessage());
        }

        try {
            Optional<PriceLevel> bestBid = valrGateway.getOrderBook(pair).bestBid();
            if (bestBid.isEmpty()) {
                log.error("event=liquidation_failed pair={} quantity={} reason={} detail=no_bids", pair, sellQuantity, reason);
                return Optional.empty();
            }
            BigDecimal price = orderPricingService.roundPrice(pair, bestBid.get().price());
            String orderId = valrGateway.placeLimitOrder(pair, OrderSide.SELL, sellQuantity, price, false);
            log.info("event=liquidation_sent type=limit pair={} quantity={} price={} reason={} order_id={}",
                    pair, sellQuantity, price, reason, orderId);
            return Optional.of(orderId);
        } catch (ExchangeException e) {
            log.error("event=liquidation_failed pair={} quantity={} reason={}", pair, sellQuantity, reason, e);
            return Optional.empty();
        }
    }
}
