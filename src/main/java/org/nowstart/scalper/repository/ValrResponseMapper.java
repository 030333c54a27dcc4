package org.nowstart.scalper.repository;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.FillDto;
import org.nowstart.scalper.data.dto.OpenOrderDto;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.dto.PriceLevel;
import org.nowstart.scalper.data.type.ExchangeOrderStatus;
import org.nowstart.scalper.data.type.OrderSide;
import org.springframework.stereotype.Component;

/**
 * Normalizes VALR payloads whose field names and casing differ between endpoint variants.
 */
@Slf4j
@Component
public class ValrResponseMapper {

    private static final Set<String> FILLED_STATUSES = Set.of("filled", "done", "complete", "completed");
    private static final Set<String> PARTIAL_STATUSES = Set.of("partiallyfilled", "partial");
    private static final Set<String> CANCELLED_STATUSES = Set.of(
            "cancelled", "canceled", "cancel", "failed", "expired", "rejected"
    );

    public ExchangeOrderStatus normalizeStatus(String rawStatus) {
        if (rawStatus == null) {
            return ExchangeOrderStatus.PENDING;
        }

        String normalized = rawStatus.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
        if (FILLED_STATUSES.contains(normalized)) {
            return ExchangeOrderStatus.FILLED;
        }
        if (PARTIAL_STATUSES.contains(normalized)) {
            return ExchangeOrderStatus.PARTIALLY_FILLED;
        }
        if (CANCELLED_STATUSES.contains(normalized)) {
            return ExchangeOrderStatus.CANCELLED;
        }
        return ExchangeOrderStatus.PENDING;
    }

    public OrderStatusDto toOrderStatus(String orderId, JsonNode node) {
        String rawStatus = text(node, "orderStatusType", "status", "orderStatus");
        BigDecimal originalQuantity = decimal(node, "originalQuantity", "quantity");
        BigDecimal filledQuantity = decimal(node, "filledQuantity", "executedQuantity", "cumulativeQuantity");
        if (filledQuantity == null) {
            BigDecimal remaining = decimal(node, "remainingQuantity");
            if (originalQuantity != null && remaining != null) {
                filledQuantity = originalQuantity.subtract(remaining).max(BigDecimal.ZERO);
            }
        }

        BigDecimal averagePrice = decimal(node, "averagePrice", "avgPrice", "averageFillPrice", "executedPrice");
        if (averagePrice != null && averagePrice.signum() <= 0) {
            averagePrice = null;
        }

        String resolvedId = text(node, "orderId", "id");
        return new OrderStatusDto(
                resolvedId == null ? orderId : resolvedId,
                normalizeStatus(rawStatus),
                rawStatus,
                originalQuantity,
                filledQuantity == null ? BigDecimal.ZERO : filledQuantity,
                averagePrice
        );
    }

    public String toOrderId(JsonNode node) {
        return text(node, "id", "orderId");
    }

    public Map<String, BigDecimal> toBalances(JsonNode node) {
        JsonNode entries = node != null && node.has("balances") ? node.get("balances") : node;
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        if (entries == null || !entries.isArray()) {
            return balances;
        }

        for (JsonNode entry : entries) {
            String currency = text(entry, "currency", "currencyCode");
            BigDecimal available = decimal(entry, "available");
            if (currency != null && available != null) {
                balances.put(currency.toUpperCase(Locale.ROOT), available);
            }
        }
        return balances;
    }

    public OrderBookDto toOrderBook(String pair, JsonNode node) {
        List<PriceLevel> bids = levels(field(node, "Bids", "bids"));
        List<PriceLevel> asks = levels(field(node, "Asks", "asks"));
        bids.sort(Comparator.comparing(PriceLevel::price).reversed());
        asks.sort(Comparator.comparing(PriceLevel::price));
        return new OrderBookDto(pair, bids, asks);
    }

    public List<OpenOrderDto> toOpenOrders(JsonNode node) {
        List<OpenOrderDto> orders = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return orders;
        }

        for (JsonNode entry : node) {
            String orderId = text(entry, "orderId", "id");
            OrderSide side = orderSide(text(entry, "side"));
            if (orderId == null || side == null) {
                log.warn("event=open_order_skipped order_id={} side={}", orderId, text(entry, "side"));
                continue;
            }
            orders.add(new OpenOrderDto(
                    orderId,
                    text(entry, "currencyPair", "pair"),
                    side,
                    decimal(entry, "price", "limitPrice", "orderPrice"),
                    decimal(entry, "originalQuantity", "quantity", "remainingQuantity", "baseAmount")
            ));
        }
        return orders;
    }

    private OrderSide orderSide(String side) {
        if (side == null) {
            return null;
        }
        return switch (side.toLowerCase(Locale.ROOT)) {
            case "buy", "bid" -> OrderSide.BUY;
            case "sell", "ask" -> OrderSide.SELL;
            default -> null;
        };
    }

    /**
     * Fills for one order. Trade-history payloads list every trade of the pair, so entries carrying
     * a different order id are dropped.
     */
    public List<FillDto> toFills(String orderId, JsonNode node) {
        JsonNode entries = field(node, "fills", "trades");
        if (entries == null) {
            entries = node;
        }

        List<FillDto> fills = new ArrayList<>();
        if (entries == null || !entries.isArray()) {
            return fills;
        }

        for (JsonNode entry : entries) {
            String fillOrderId = text(entry, "orderId");
            if (fillOrderId != null && !fillOrderId.equals(orderId)) {
                continue;
            }
            BigDecimal price = decimal(entry, "price");
            BigDecimal quantity = decimal(entry, "quantity", "baseAmount");
            if (price != null && quantity != null) {
                fills.add(new FillDto(orderId, price, quantity));
            }
        }
        return fills;
    }

    public static BigDecimal volumeWeightedPrice(List<FillDto> fills) {
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        for (FillDto fill : fills) {
            quantity = quantity.add(fill.quantity());
            notional = notional.add(fill.quantity().multiply(fill.price()));
        }
        if (quantity.signum() <= 0) {
            return null;
        }
        return notional.divide(quantity, 12, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    private List<PriceLevel> levels(JsonNode node) {
        List<PriceLevel> levels = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return levels;
        }

        for (JsonNode entry : node) {
            BigDecimal price = decimal(entry, "price");
            BigDecimal quantity = decimal(entry, "quantity");
            if (price != null && price.signum() > 0 && quantity != null) {
                levels.add(new PriceLevel(price, quantity));
            }
        }
        return levels;
    }

    private JsonNode field(JsonNode node, String... names) {
        if (node == null) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private String text(JsonNode node, String... names) {
        JsonNode value = field(node, names);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private BigDecimal decimal(JsonNode node, String... names) {
        String value = text(node, names);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
