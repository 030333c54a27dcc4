package org.nowstart.scalper.service.entry;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.model.EntryQuote;
import org.nowstart.scalper.data.type.EntryPricing;
import org.nowstart.scalper.service.OrderPricingService;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MarketEntryPricing implements EntryPricingStrategy {

    private final OrderPricingService orderPricingService;

    @Override
    public EntryPricing type() {
        return EntryPricing.MARKET;
    }

    @Override
    public Optional<EntryQuote> quote(String pair, OrderBookDto orderBook, BigDecimal tradeAmount) {
        return orderBook.bestAsk().map(ask -> new EntryQuote(
                ask.price(),
                orderPricingService.quantityFor(pair, tradeAmount, ask.price()),
                tradeAmount,
                true,
                false
        ));
    }
}
