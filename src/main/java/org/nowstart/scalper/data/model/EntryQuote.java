package org.nowstart.scalper.data.model;

import java.math.BigDecimal;

/**
 * Entry order parameters chosen from the book. For market entries {@code price} is the reference
 * ask and {@code quantity} an estimate; the exchange spends {@code notional} in the quote currency.
 */
public record EntryQuote(
        BigDecimal price,
        BigDecimal quantity,
        BigDecimal notional,
        boolean market,
        boolean postOnly
) {
}
