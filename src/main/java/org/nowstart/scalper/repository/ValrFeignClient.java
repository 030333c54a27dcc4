package org.nowstart.scalper.repository;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.nowstart.scalper.config.ValrFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Authenticated VALR endpoints. Responses stay as raw JSON because VALR returns different shapes
 * for the same resource depending on the endpoint variant.
 */
@FeignClient(
        name = "valrClient",
        url = "${scalper.valr.base-url}",
        configuration = ValrFeignConfig.class
)
public interface ValrFeignClient {

    @GetMapping("/v1/account/balances")
    JsonNode getBalances();

    @GetMapping("/v1/marketdata/{pair}/orderbook")
    JsonNode getMarketDataOrderBook(@PathVariable("pair") String pair);

    @GetMapping("/v1/public/{pair}/orderbook")
    JsonNode getPublicOrderBook(@PathVariable("pair") String pair);

    @PostMapping(value = "/v1/orders/limit", consumes = "application/json")
    JsonNode placeLimitOrder(@RequestBody Map<String, Object> request);

    @PostMapping(value = "/v1/orders/market", consumes = "application/json")
    JsonNode placeMarketOrder(@RequestBody Map<String, Object> request);

    @PostMapping(value = "/v1/orders/stop/limit", consumes = "application/json")
    JsonNode placeStopLimitOrder(@RequestBody Map<String, Object> request);

    @PostMapping(value = "/v1/orders", consumes = "application/json")
    JsonNode placeOrder(@RequestBody Map<String, Object> request);

    @DeleteMapping(value = "/v1/orders/order", consumes = "application/json")
    void cancelOrder(@RequestBody Map<String, Object> request);

    @DeleteMapping("/v1/orders/{orderId}")
    void cancelOrderById(@PathVariable("orderId") String orderId);

    @GetMapping("/v1/orders/{pair}/orderid/{orderId}")
    JsonNode getOrderStatus(@PathVariable("pair") String pair, @PathVariable("orderId") String orderId);

    @GetMapping("/v1/orders/{orderId}")
    JsonNode getOrder(@PathVariable("orderId") String orderId);

    @GetMapping("/v1/orders/open")
    JsonNode getOpenOrders();

    @GetMapping("/v1/orders/{orderId}/fills")
    JsonNode getOrderFills(@PathVariable("orderId") String orderId);

    @GetMapping("/v1/account/{pair}/tradehistory")
    JsonNode getTradeHistory(@PathVariable("pair") String pair, @RequestParam("limit") int limit);
}
