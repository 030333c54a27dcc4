package org.nowstart.scalper.service.signal;

import java.util.Optional;
import org.nowstart.scalper.data.model.TradingSignal;

public interface SignalSource {

    /**
     * A buy signal for {@code pair}, or empty when there is nothing to act on this cycle.
     */
    Optional<TradingSignal> evaluate(String pair);
}
