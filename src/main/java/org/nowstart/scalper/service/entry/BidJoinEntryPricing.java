package org.nowstart.scalper.service.entry;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.model.EntryQuote;
import org.nowstart.scalper.data.type.EntryPricing;
import org.nowstart.scalper.service.OrderPricingService;
import org.springframework.stereotype.Component;

/**
 * Rests a post-only bid at the best bid. Cheaper fees, lower fill probability.
 */
@Component
@RequiredArgsConstructor
public class BidJoinEntryPricing implements EntryPricingStrategy {

    private final OrderPricingService orderPricingService;

    @Override
    public EntryPricing type() {
        return EntryPricing.BID_JOIN;
    }

    @Override
    public Optional<EntryQuote> quote(String pair, OrderBookDto orderBook, BigDecimal tradeAmount) {
        return orderBook.bestBid().map(bid -> {
            BigDecimal price = orderPricingService.roundPrice(pair, bid.price());
            BigDecimal quantity = orderPricingService.quantityFor(pair, tradeAmount, price);
            return new EntryQuote(price, quantity, price.multiply(quantity), false, true);
        });
    }
}
