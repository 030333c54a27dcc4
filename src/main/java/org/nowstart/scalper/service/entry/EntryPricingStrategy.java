package org.nowstart.scalper.service.entry;

import java.math.BigDecimal;
import java.util.Optional;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.model.EntryQuote;
import org.nowstart.scalper.data.type.EntryPricing;

public interface EntryPricingStrategy {

    EntryPricing type();

    /**
     * Empty when the book lacks the side this strategy prices from.
     */
    Optional<EntryQuote> quote(String pair, OrderBookDto orderBook, BigDecimal tradeAmount);
}
