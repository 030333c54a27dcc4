package org.nowstart.scalper.repository;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.model.OrderRecord;
import org.nowstart.scalper.data.model.OrderStoreDocument;
import org.nowstart.scalper.data.property.TradingProperties;
import org.nowstart.scalper.data.type.OrderRecordStatus;
import org.springframework.stereotype.Repository;

/**
 * Active orders the bot placed. Terminal records are pruned as soon as their status changes.
 */
@Slf4j
@Repository
public class OrderRecordRepository {

    static final String FILE_NAME = "orders.json";
    static final String DOCUMENT_VERSION = "1.0";

    private final JsonDocumentStore jsonDocumentStore;
    private final Clock clock;
    private final Path file;
    private final Map<String, OrderRecord> orders = new LinkedHashMap<>();

    public OrderRecordRepository(JsonDocumentStore jsonDocumentStore, TradingProperties tradingProperties, Clock clock) {
        this.jsonDocumentStore = jsonDocumentStore;
        this.clock = clock;
        this.file = Path.of(tradingProperties.dataDirectory(), FILE_NAME);
    }

    public synchronized int load() {
        orders.clear();
        Optional<OrderStoreDocument> document = jsonDocumentStore.read(file, OrderStoreDocument.class);
        document.map(OrderStoreDocument::orders)
                .orElseGet(List::of)
                .stream()
                .filter(order -> order.getStatus() == OrderRecordStatus.ACTIVE)
                .forEach(order -> orders.put(order.getId(), order));
        log.info("event=order_records_loaded count={} file={}", orders.size(), file);
        return orders.size();
    }

    public synchronized void add(OrderRecord order) {
        orders.put(order.getId(), order);
        save();
    }

    public synchronized boolean updateStatus(String orderId, OrderRecordStatus status) {
        OrderRecord order = orders.get(orderId);
        if (order == null) {
            return false;
        }

        order.setStatus(status);
        order.setLastUpdated(clock.instant());
        if (status.isTerminal()) {
            orders.remove(orderId);
        }
        save();
        return true;
    }

    public synchronized int pruneOlderThan(Duration maxAge) {
        Instant threshold = clock.instant().minus(maxAge);
        int before = orders.size();
        orders.values().removeIf(order -> order.getCreatedAt() != null && order.getCreatedAt().isBefore(threshold));
        int removed = before - orders.size();
        if (removed > 0) {
            save();
        }
        return removed;
    }

    /**
     * Drops every record whose id is not in {@code liveOrderIds}.
     */
    public synchronized int retainOnly(Set<String> liveOrderIds) {
        int before = orders.size();
        orders.keySet().removeIf(orderId -> !liveOrderIds.contains(orderId));
        int removed = before - orders.size();
        if (removed > 0) {
            save();
        }
        return removed;
    }

    public synchronized void save() {
        jsonDocumentStore.write(file, new OrderStoreDocument(DOCUMENT_VERSION, clock.instant(), new ArrayList<>(orders.values())));
    }

    Path file() {
        return file;
    }
}
