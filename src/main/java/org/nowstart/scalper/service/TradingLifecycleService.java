package org.nowstart.scalper.service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.ValrServerTimeResponse;
import org.nowstart.scalper.data.exception.PersistenceException;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.repository.OrderRecordRepository;
import org.nowstart.scalper.repository.ValrPublicFeignClient;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingLifecycleService {

    static final Duration MAX_CLOCK_DRIFT = Duration.ofSeconds(5);

    private final PositionRecoveryService positionRecoveryService;
    private final TradingStateService tradingStateService;
    private final TradingShutdownSignal tradingShutdownSignal;
    private final OrderRecordRepository orderRecordRepository;
    private final ValrPublicFeignClient valrPublicFeignClient;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        checkClockDrift();
        try {
            positionRecoveryService.recover();
        } catch (Exception e) {
            log.error("event=startup_recovery_failed", e);
        }
        tradingStateService.markReady();
        log.info("event=trading_ready pairs={} entry_pricing={} protection_mode={}",
                tradingProperties.pairs(), tradingProperties.entryPricing(), tradingProperties.protectionMode());
    }

    @PreDestroy
    public void stop() {
        if (!tradingShutdownSignal.requestShutdown()) {
            return;
        }
        log.info("event=trading_shutdown_requested open_positions={}", tradingStateService.openPositions().size());
        tradingStateService.flush();
    }

    public int pruneStaleOrderRecords() {
        try {
            int removed = orderRecordRepository.pruneOlderThan(tradingProperties.staleOrderAge());
            if (removed > 0) {
                log.info("event=stale_order_records_pruned removed={} max_age={}", removed, tradingProperties.staleOrderAge());
            }
            return removed;
        } catch (PersistenceException e) {
            log.error("event=stale_order_records_prune_failed", e);
            return 0;
        }
    }

    private void checkClockDrift() {
        try {
            ValrServerTimeResponse serverTime = valrPublicFeignClient.getServerTime();
            Duration drift = Duration.between(Instant.ofEpochSecond(serverTime.epochTime()), clock.instant()).abs();
            if (drift.compareTo(MAX_CLOCK_DRIFT) > 0) {
                log.warn("event=clock_drift_detected drift_ms={} server_time={}", drift.toMillis(), serverTime.time());
            } else {
                log.info("event=clock_drift_checked drift_ms={}", drift.toMillis());
            }
        } catch (Exception e) {
            log.warn("event=clock_drift_check_failed message={}", e.getMessage());
        }
    }
}
