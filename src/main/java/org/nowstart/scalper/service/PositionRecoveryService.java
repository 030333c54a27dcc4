package org.nowstart.scalper.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.OpenOrderDto;
import org.nowstart.scalper.data.exception.ExchangeException;
import org.nowstart.scalper.data.exception.PersistenceException;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.type.OrderSide;
import org.nowstart.scalper.data.type.PositionStatus;
import org.nowstart.scalper.repository.OrderRecordRepository;
import org.nowstart.scalper.repository.PositionRepository;
import org.nowstart.scalper.repository.ValrGateway;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the active position set at startup, from disk when possible and otherwise from pairs of
 * resting sell orders on the exchange.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionRecoveryService {

    static final String RECOVERED_ENTRY_ORDER_ID = "recovered";
    static final BigDecimal QUANTITY_MATCH_TOLERANCE = new BigDecimal("0.00001");

    private final ValrGateway valrGateway;
    private final PositionRepository positionRepository;
    private final OrderRecordRepository orderRecordRepository;
    private final OrderPricingService orderPricingService;
    private final TradingStateService tradingStateService;
    private final Clock clock;

    public int recover() {
        loadOrderRecords();

        Map<String, Position> persisted = loadPersistedPositions();
        if (!persisted.isEmpty()) {
            tradingStateService.restore(persisted.values());
            log.info("event=positions_recovered source=disk count={}", persisted.size());
            try {
                reconcileOrderRecords(valrGateway.getOpenOrders());
            } catch (ExchangeException e) {
                log.warn("event=order_records_reconcile_skipped message={}", e.getMessage());
            }
            return persisted.size();
        }

        List<OpenOrderDto> openOrders;
        try {
            openOrders = valrGateway.getOpenOrders();
        } catch (ExchangeException e) {
            log.error("event=position_recovery_failed source=exchange", e);
            return 0;
        }

        reconcileOrderRecords(openOrders);
        List<Position> recovered = rebuildFromOpenOrders(openOrders);
        if (!recovered.isEmpty()) {
            tradingStateService.restore(recovered);
        }
        log.info("event=positions_recovered source=exchange count={} open_orders={}", recovered.size(), openOrders.size());
        return recovered.size();
    }

    List<Position> rebuildFromOpenOrders(List<OpenOrderDto> openOrders) {
        Map<String, List<OpenOrderDto>> sellsByPair = openOrders.stream()
                .filter(order -> order.side() == OrderSide.SELL)
                .filter(order -> order.pair() != null && order.quantity() != null && order.price() != null)
                .collect(Collectors.groupingBy(OpenOrderDto::pair, LinkedHashMap::new, Collectors.toList()));

        openOrders.stream()
                .filter(order -> order.side() == OrderSide.BUY)
                .forEach(order -> log.warn("event=recovery_unmatched_order pair={} order_id={} side=BUY",
                        order.pair(), order.orderId()));

        Instant now = clock.instant();
        List<Position> positions = new ArrayList<>();
        for (Map.Entry<String, List<OpenOrderDto>> entry : sellsByPair.entrySet()) {
            positions.addAll(matchPair(entry.getKey(), new ArrayList<>(entry.getValue()), now));
        }
        return positions;
    }

    private List<Position> matchPair(String pair, List<OpenOrderDto> sells, Instant now) {
        List<Position> positions = new ArrayList<>();
        while (!sells.isEmpty()) {
            OpenOrderDto first = sells.remove(0);
            OpenOrderDto partner = null;
            for (OpenOrderDto candidate : sells) {
                boolean sameQuantity = first.quantity().subtract(candidate.quantity()).abs()
                        .compareTo(QUANTITY_MATCH_TOLERANCE) < 0;
                if (sameQuantity && first.price().compareTo(candidate.price()) != 0) {
                    partner = candidate;
                    break;
                }
            }

            if (partner == null) {
                log.warn("event=recovery_unmatched_order pair={} order_id={} side=SELL quantity={} price={}",
                        pair, first.orderId(), first.quantity(), first.price());
                continue;
            }
            sells.remove(partner);

            OpenOrderDto takeProfit = first.price().compareTo(partner.price()) > 0 ? first : partner;
            OpenOrderDto stopLoss = takeProfit == first ? partner : first;
            BigDecimal entryPrice = orderPricingService.inferEntryFromTakeProfit(pair, takeProfit.price());
            if (entryPrice.compareTo(stopLoss.price()) <= 0) {
                log.warn("event=recovery_pair_rejected pair={} tp_price={} sl_price={} inferred_entry={}",
                        pair, takeProfit.price(), stopLoss.price(), entryPrice);
                continue;
            }

            Position position = Position.builder()
                    .id(pair + "_recovered_" + now.getEpochSecond() + (positions.isEmpty() ? "" : "_" + positions.size()))
                    .pair(pair)
                    .quantity(first.quantity())
                    .entryPrice(entryPrice)
                    .takeProfitPrice(takeProfit.price())
                    .stopLossPrice(stopLoss.price())
                    .createdAt(now)
                    .entryFilledAt(now)
                    .status(PositionStatus.OPEN)
                    .entryOrderId(RECOVERED_ENTRY_ORDER_ID)
                    .takeProfitOrderId(takeProfit.orderId())
                    .stopLossOrderId(stopLoss.orderId())
                    .build();
            positions.add(position);
            log.info("event=position_rebuilt position_id={} pair={} quantity={} inferred_entry={} tp_order_id={} sl_order_id={}",
                    position.getId(), pair, position.getQuantity(), entryPrice,
                    position.getTakeProfitOrderId(), position.getStopLossOrderId());
        }
        return positions;
    }

    private void loadOrderRecords() {
        try {
            orderRecordRepository.load();
        } catch (PersistenceException e) {
            log.error("event=order_records_load_failed", e);
        }
    }

    private Map<String, Position> loadPersistedPositions() {
        try {
            return positionRepository.loadAll();
        } catch (PersistenceException e) {
            log.error("event=positions_load_failed", e);
            return Map.of();
        }
    }

    private void reconcileOrderRecords(List<OpenOrderDto> openOrders) {
        Set<String> liveIds = openOrders.stream().map(OpenOrderDto::orderId).collect(Collectors.toSet());
        try {
            int removed = orderRecordRepository.retainOnly(liveIds);
            if (removed > 0) {
                log.info("event=order_records_reconciled removed={}", removed);
            }
        } catch (PersistenceException e) {
            log.error("event=order_records_reconcile_failed", e);
        }
    }
}
