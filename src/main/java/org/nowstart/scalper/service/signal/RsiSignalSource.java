package org.nowstart.scalper.service.signal;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.ValrMarketSummaryResponse;
import org.nowstart.scalper.data.model.TradingSignal;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.repository.ValrPublicFeignClient;
import org.springframework.stereotype.Service;

/**
 * Samples the last traded price once per scan and emits a buy signal when RSI drops below the
 * configured threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RsiSignalSource implements SignalSource {

    static final String SOURCE = "rsi";
    private static final int HISTORY_MULTIPLIER = 4;

    private final ValrPublicFeignClient valrPublicFeignClient;
    private final SignalComputationService signalComputationService;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private final Map<String, Deque<Double>> priceHistory = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSignalAt = new ConcurrentHashMap<>();

    @Override
    public Optional<TradingSignal> evaluate(String pair) {
        ValrMarketSummaryResponse summary = valrPublicFeignClient.getMarketSummary(pair);
        BigDecimal lastPrice = parseDecimal(summary == null ? null : summary.lastTradedPrice());
        if (lastPrice == null || lastPrice.signum() <= 0) {
            log.warn("event=signal_skipped pair={} reason=no_last_price", pair);
            return Optional.empty();
        }

        int period = tradingProperties.rsiPeriod();
        double[] closes = record(pair, lastPrice.doubleValue(), period);
        if (closes.length <= period) {
            log.debug("event=signal_warmup pair={} samples={} required={}", pair, closes.length, period + 1);
            return Optional.empty();
        }

        double[] rsi = signalComputationService.wilderRsi(closes, period);
        double latest = rsi[rsi.length - 1];
        double threshold = tradingProperties.signalThreshold().doubleValue();
        boolean buySignal = latest < threshold;
        log.info("event=rsi_signal pair={} last_price={} rsi={} threshold={} buy_signal={}",
                pair, lastPrice, latest, threshold, buySignal);
        if (!buySignal) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Instant previous = lastSignalAt.get(pair);
        if (previous != null && now.isBefore(previous.plus(tradingProperties.signalCooldown()))) {
            log.info("event=signal_skipped pair={} reason=cooldown last_signal_at={}", pair, previous);
            return Optional.empty();
        }

        lastSignalAt.put(pair, now);
        double confidence = threshold <= 0 ? 0.0 : Math.min(1.0, (threshold - latest) / threshold);
        return Optional.of(new TradingSignal(pair, latest, confidence, SOURCE));
    }

    private double[] record(String pair, double price, int period) {
        Deque<Double> history = priceHistory.computeIfAbsent(pair, ignored -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(price);
            while (history.size() > period * HISTORY_MULTIPLIER) {
                history.pollFirst();
            }
            return history.stream().mapToDouble(Double::doubleValue).toArray();
        }
    }

    private BigDecimal parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
