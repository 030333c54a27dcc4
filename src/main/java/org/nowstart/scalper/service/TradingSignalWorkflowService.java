package org.nowstart.scalper.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.model.TradeSetupResult;
import org.nowstart.scalper.data.model.TradingSignal;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.service.signal.SignalSource;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingSignalWorkflowService {

    static final String MANUAL_SOURCE = "manual";

    private final SignalSource signalSource;
    private final TradeSetupService tradeSetupService;
    private final TradingStateService tradingStateService;
    private final TradingShutdownSignal tradingShutdownSignal;
    private final TradingProperties tradingProperties;

    public void runOnce() {
        if (!tradingStateService.isReady() || tradingShutdownSignal.isShutdownRequested()) {
            return;
        }

        List<String> pairs = tradingProperties.pairs().stream()
                .map(this::normalizePair)
                .filter(pair -> !pair.isBlank())
                .distinct()
                .toList();

        for (String pair : pairs) {
            if (tradingShutdownSignal.isShutdownRequested()) {
                return;
            }
            try {
                Optional<TradingSignal> signal = signalSource.evaluate(pair);
                signal.ifPresent(value -> logResult(pair, tradeSetupService.executeTradeSetup(pair, value)));
            } catch (Exception e) {
                log.error("Failed to evaluate pair={}", pair, e);
            }
        }
    }

    public TradeSetupResult executeManualSignal(String pair) {
        String normalized = normalizePair(pair);
        TradeSetupResult result = tradeSetupService.executeTradeSetup(
                normalized, new TradingSignal(normalized, Double.NaN, 1.0, MANUAL_SOURCE));
        logResult(normalized, result);
        return result;
    }

    private void logResult(String pair, TradeSetupResult result) {
        if (result instanceof TradeSetupResult.Opened opened) {
            log.info("event=trade_setup_result pair={} opened=true position_id={}", pair, opened.position().getId());
        } else if (result instanceof TradeSetupResult.NoTrade noTrade) {
            log.info("event=trade_setup_result pair={} opened=false reason={} detail={}",
                    pair, noTrade.reason(), noTrade.detail());
        }
    }

    private String normalizePair(String pair) {
        return pair == null ? "" : pair.trim().toUpperCase(Locale.ROOT);
    }
}
