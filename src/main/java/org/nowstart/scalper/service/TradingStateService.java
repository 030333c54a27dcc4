package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.TradingStatusDto;
import org.nowstart.scalper.data.exception.PersistenceException;
import org.nowstart.scalper.data.model.DailyCounters;
import org.nowstart.scalper.data.model.OrderRecord;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.data.type.OrderRecordStatus;
import org.nowstart.scalper.data.type.PositionStatus;
import org.nowstart.scalper.repository.OrderRecordRepository;
import org.nowstart.scalper.repository.PositionRepository;
import org.springframework.stereotype.Service;

/**
 * Owns the active position map and the UTC daily counters. All mutation happens under one lock;
 * exchange calls are made by callers outside of it.
 */
@Slf4j
@Service
public class TradingStateService {

    private final PositionRepository positionRepository;
    private final OrderRecordRepository orderRecordRepository;
    private final TradingProperties tradingProperties;
    private final TradingShutdownSignal tradingShutdownSignal;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Position> activePositions = new LinkedHashMap<>();
    private final Set<String> closingPositionIds = new HashSet<>();
    private final DailyCounters counters;
    private volatile boolean ready;

    public TradingStateService(
            PositionRepository positionRepository,
            OrderRecordRepository orderRecordRepository,
            TradingProperties tradingProperties,
            TradingShutdownSignal tradingShutdownSignal,
            Clock clock
    ) {
        this.positionRepository = positionRepository;
        this.orderRecordRepository = orderRecordRepository;
        this.tradingProperties = tradingProperties;
        this.tradingShutdownSignal = tradingShutdownSignal;
        this.clock = clock;
        this.counters = new DailyCounters(LocalDate.now(clock));
    }

    public boolean isDailyLimitReached() {
        lock.lock();
        try {
            rollOverIfNeeded();
            return counters.getTradesToday() >= tradingProperties.maxDailyTrades();
        } finally {
            lock.unlock();
        }
    }

    public void recordTrade() {
        lock.lock();
        try {
            rollOverIfNeeded();
            counters.recordTrade();
        } finally {
            lock.unlock();
        }
    }

    public void recordFailedTrade() {
        lock.lock();
        try {
            rollOverIfNeeded();
            counters.recordFailedTrade();
        } finally {
            lock.unlock();
        }
    }

    public void recordExit(BigDecimal pnl) {
        lock.lock();
        try {
            rollOverIfNeeded();
            counters.recordExit(pnl);
        } finally {
            lock.unlock();
        }
    }

    public List<Position> openPositions() {
        lock.lock();
        try {
            return new ArrayList<>(activePositions.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Position> findPosition(String positionId) {
        lock.lock();
        try {
            return Optional.ofNullable(activePositions.get(positionId));
        } finally {
            lock.unlock();
        }
    }

    public boolean hasOpenPosition(String pair) {
        lock.lock();
        try {
            return activePositions.values().stream().anyMatch(position -> position.getPair().equals(pair));
        } finally {
            lock.unlock();
        }
    }

    public void openPosition(Position position) {
        lock.lock();
        try {
            activePositions.put(position.getId(), position);
            persist(position);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims a position for closing. Empty when it is unknown or another caller is already closing
     * it, which makes every close path idempotent.
     */
    public Optional<Position> beginClose(String positionId) {
        lock.lock();
        try {
            Position position = activePositions.get(positionId);
            if (position == null || !closingPositionIds.add(positionId)) {
                return Optional.empty();
            }
            return Optional.of(position);
        } finally {
            lock.unlock();
        }
    }

    public void abortClose(String positionId) {
        lock.lock();
        try {
            closingPositionIds.remove(positionId);
        } finally {
            lock.unlock();
        }
    }

    public void completeClose(Position position) {
        lock.lock();
        try {
            position.setStatus(PositionStatus.CLOSED);
            activePositions.remove(position.getId());
            closingPositionIds.remove(position.getId());
            try {
                positionRepository.delete(position.getId());
            } catch (PersistenceException e) {
                log.error("event=position_persist_failed action=delete position_id={}", position.getId(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    public void restore(Collection<Position> positions) {
        lock.lock();
        try {
            positions.forEach(position -> activePositions.put(position.getId(), position));
            try {
                positionRepository.saveAll(activePositions.values());
            } catch (PersistenceException e) {
                log.error("event=position_persist_failed action=restore count={}", positions.size(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    public void trackOrder(OrderRecord order) {
        try {
            orderRecordRepository.add(order);
        } catch (PersistenceException e) {
            log.error("event=order_record_persist_failed order_id={}", order.getId(), e);
        }
    }

    public void updateOrder(String orderId, OrderRecordStatus status) {
        if (orderId == null) {
            return;
        }
        try {
            orderRecordRepository.updateStatus(orderId, status);
        } catch (PersistenceException e) {
            log.error("event=order_record_persist_failed order_id={} status={}", orderId, status, e);
        }
    }

    /**
     * Writes the current positions and order records. Called on shutdown.
     */
    public void flush() {
        lock.lock();
        try {
            positionRepository.saveAll(activePositions.values());
            orderRecordRepository.save();
            log.info("event=trading_state_flushed positions={}", activePositions.size());
        } catch (PersistenceException e) {
            log.error("event=trading_state_flush_failed", e);
        } finally {
            lock.unlock();
        }
    }

    public void markReady() {
        ready = true;
    }

    public boolean isReady() {
        return ready;
    }

    public TradingStatusDto status() {
        lock.lock();
        try {
            rollOverIfNeeded();
            return new TradingStatusDto(
                    counters.getDate(),
                    counters.getTradesToday(),
                    tradingProperties.maxDailyTrades(),
                    counters.getWinsToday(),
                    counters.getLossesToday(),
                    counters.getFailedToday(),
                    counters.getDailyPnl(),
                    activePositions.size(),
                    counters.getTradesToday() >= tradingProperties.maxDailyTrades(),
                    ready,
                    tradingShutdownSignal.isShutdownRequested()
            );
        } finally {
            lock.unlock();
        }
    }

    private void persist(Position position) {
        try {
            positionRepository.save(position);
        } catch (PersistenceException e) {
            log.error("event=position_persist_failed action=save position_id={}", position.getId(), e);
        }
    }

    private void rollOverIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        LocalDate previous = counters.getDate();
        if (counters.rollOver(today)) {
            log.info("event=daily_counters_reset previous_date={} date={}", previous, today);
        }
    }
}
