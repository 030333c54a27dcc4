package org.nowstart.scalper.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.dto.FillDto;
import org.nowstart.scalper.data.dto.OpenOrderDto;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.exception.ValrApiException;
import org.nowstart.scalper.data.exception.ValrConnectionException;
import org.nowstart.scalper.data.exception.ValrRateLimitException;
import org.nowstart.scalper.data.property.ValrProperties;
import org.nowstart.scalper.data.type.OrderSide;
import org.nowstart.scalper.service.Sleeper;
import org.nowstart.scalper.service.ValrRateLimiter;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
@RequiredArgsConstructor
public class ValrFeignGateway implements ValrGateway {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int TRADE_HISTORY_LIMIT = 100;

    private final ValrFeignClient valrFeignClient;
    private final ValrResponseMapper valrResponseMapper;
    private final ValrRateLimiter valrRateLimiter;
    private final ValrProperties valrProperties;
    private final Sleeper sleeper;
    private final Clock clock;

    @Override
    public Map<String, BigDecimal> getAccountBalances() {
        JsonNode response = execute("balances", List.of(valrFeignClient::getBalances));
        return valrResponseMapper.toBalances(response);
    }

    @Override
    public OrderBookDto getOrderBook(String pair) {
        JsonNode response = execute("order_book", List.of(
                () -> valrFeignClient.getMarketDataOrderBook(pair),
                () -> valrFeignClient.getPublicOrderBook(pair)
        ));
        return valrResponseMapper.toOrderBook(pair, response);
    }

    @Override
    public String placeLimitOrder(String pair, OrderSide side, BigDecimal quantity, BigDecimal price, boolean postOnly) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("pair", pair);
        request.put("side", side.name());
        request.put("quantity", stringify(quantity));
        request.put("price", stringify(price));
        request.put("postOnly", postOnly);
        request.put("timeInForce", "GTC");

        JsonNode response = execute("place_limit_order", List.of(
                () -> valrFeignClient.placeLimitOrder(request),
                () -> valrFeignClient.placeOrder(withType(request, "LIMIT"))
        ));
        String orderId = requireOrderId(response, "place_limit_order");
        log.info(
                "event=order_placed type=limit pair={} side={} quantity={} price={} post_only={} order_id={}",
                pair, side, stringify(quantity), stringify(price), postOnly, orderId
        );
        return orderId;
    }

    @Override
    public String placeMarketOrder(String pair, OrderSide side, BigDecimal amount) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("pair", pair);
        request.put("side", side.name());
        if (side == OrderSide.BUY) {
            request.put("quoteAmount", stringify(amount));
        } else {
            request.put("baseAmount", stringify(amount));
        }

        JsonNode response = execute("place_market_order", List.of(
                () -> valrFeignClient.placeMarketOrder(request),
                () -> valrFeignClient.placeOrder(withType(request, "MARKET"))
        ));
        String orderId = requireOrderId(response, "place_market_order");
        log.info("event=order_placed type=market pair={} side={} amount={} order_id={}",
                pair, side, stringify(amount), orderId);
        return orderId;
    }

    @Override
    public String placeStopLimitOrder(
            String pair,
            OrderSide side,
            BigDecimal quantity,
            BigDecimal stopPrice,
            BigDecimal limitPrice
    ) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("pair", pair);
        request.put("side", side.name());
        request.put("quantity", stringify(quantity));
        request.put("price", stringify(limitPrice));
        request.put("stopPrice", stringify(stopPrice));
        request.put("type", "STOP_LOSS_LIMIT");
        request.put("timeInForce", "GTC");

        JsonNode response = execute("place_stop_limit_order", List.of(
                () -> valrFeignClient.placeStopLimitOrder(request)
        ));
        String orderId = requireOrderId(response, "place_stop_limit_order");
        log.info(
                "event=order_placed type=stop_limit pair={} side={} quantity={} stop_price={} limit_price={} order_id={}",
                pair, side, stringify(quantity), stringify(stopPrice), stringify(limitPrice), orderId
        );
        return orderId;
    }

    @Override
    public void cancelOrder(String pair, String orderId) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("orderId", orderId);
        request.put("pair", pair);

        execute("cancel_order", List.<Supplier<Void>>of(
                () -> {
                    valrFeignClient.cancelOrder(request);
                    return null;
                },
                () -> {
                    valrFeignClient.cancelOrderById(orderId);
                    return null;
                }
        ));
        log.info("event=order_cancelled pair={} order_id={}", pair, orderId);
    }

    @Override
    public OrderStatusDto getOrderStatus(String pair, String orderId) {
        JsonNode response = execute("order_status", List.of(
                () -> valrFeignClient.getOrderStatus(pair, orderId),
                () -> valrFeignClient.getOrder(orderId)
        ));
        return valrResponseMapper.toOrderStatus(orderId, response);
    }

    @Override
    public List<OpenOrderDto> getOpenOrders() {
        JsonNode response = execute("open_orders", List.of(valrFeignClient::getOpenOrders));
        return valrResponseMapper.toOpenOrders(response);
    }

    @Override
    public List<FillDto> getOrderFills(String pair, String orderId) {
        JsonNode response = execute("order_fills", List.of(
                () -> valrFeignClient.getOrderFills(orderId),
                () -> valrFeignClient.getTradeHistory(pair, TRADE_HISTORY_LIMIT)
        ));
        return valrResponseMapper.toFills(orderId, response);
    }

    /**
     * Tries each endpoint variant in order. Only a 404 moves on to the next variant; the last
     * variant's error surfaces unchanged.
     */
    private <T> T execute(String operation, List<Supplier<T>> candidates) {
        for (int index = 0; index < candidates.size(); index++) {
            boolean last = index == candidates.size() - 1;
            try {
                return executeWithRetry(operation, candidates.get(index));
            } catch (ValrApiException e) {
                if (!e.isNotFound() || last) {
                    throw e;
                }
                log.warn("event=valr_endpoint_fallback operation={} variant={} status=404", operation, index);
            }
        }
        throw new IllegalStateException("No endpoint variant configured for operation=" + operation);
    }

    private <T> T executeWithRetry(String operation, Supplier<T> call) {
        int maxRetries = valrProperties.maxRetries();
        int attempt = 0;
        while (true) {
            valrRateLimiter.acquire();
            long startedAt = clock.millis();
            try {
                T result = call.get();
                log.debug("event=valr_call operation={} status=ok latency_ms={} attempt={}",
                        operation, clock.millis() - startedAt, attempt);
                return result;
            } catch (FeignException e) {
                int status = e.status();
                log.warn("event=valr_call operation={} status={} latency_ms={} attempt={}",
                        operation, status <= 0 ? "transport_error" : status, clock.millis() - startedAt, attempt);

                if (status > 0 && status != 429 && status < 500) {
                    throw toApiException(operation, e);
                }
                if (attempt >= maxRetries) {
                    throw exhausted(operation, e, maxRetries);
                }
            }

            sleeper.sleep(backoff(attempt));
            attempt++;
        }
    }

    private RuntimeException exhausted(String operation, FeignException e, int maxRetries) {
        int status = e.status();
        if (status <= 0) {
            return new ValrConnectionException(
                    "VALR " + operation + " unreachable after " + maxRetries + " retries: " + e.getMessage(), e);
        }
        if (status == 429) {
            return new ValrRateLimitException(
                    "VALR " + operation + " still rate limited after " + maxRetries + " retries");
        }
        return toApiException(operation, e);
    }

    Duration backoff(int attempt) {
        Duration delay = valrProperties.retryBackoff().multipliedBy(1L << Math.min(attempt, 16));
        Duration cap = valrProperties.maxBackoff();
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    private ValrApiException toApiException(String operation, FeignException e) {
        String code = "http_" + e.status();
        String message = "VALR " + operation + " failed with status " + e.status();

        String body = e.contentUTF8();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode error = OBJECT_MAPPER.readTree(body);
                if (error.hasNonNull("code")) {
                    code = error.get("code").asText();
                }
                if (error.hasNonNull("message")) {
                    message = error.get("message").asText();
                }
            } catch (Exception parseError) {
                message = body;
            }
        }
        return new ValrApiException(e.status(), code, message);
    }

    private String requireOrderId(JsonNode response, String operation) {
        String orderId = valrResponseMapper.toOrderId(response);
        if (orderId == null) {
            throw new ValrApiException(200, "missing_order_id", "VALR " + operation + " returned no order id");
        }
        return orderId;
    }

    private Map<String, Object> withType(Map<String, Object> request, String type) {
        Map<String, Object> copy = new LinkedHashMap<>(request);
        copy.put("type", type);
        return copy;
    }

    private String stringify(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
