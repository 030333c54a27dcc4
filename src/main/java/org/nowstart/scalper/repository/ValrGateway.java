package org.nowstart.scalper.repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.nowstart.scalper.data.dto.FillDto;
import org.nowstart.scalper.data.dto.OpenOrderDto;
import org.nowstart.scalper.data.dto.OrderBookDto;
import org.nowstart.scalper.data.dto.OrderStatusDto;
import org.nowstart.scalper.data.type.OrderSide;

/**
 * Authenticated access to the VALR exchange. Every method throws a subtype of
 * {@link org.nowstart.scalper.data.exception.ExchangeException} on failure.
 */
public interface ValrGateway {

    /**
     * Available balance per currency code.
     */
    Map<String, BigDecimal> getAccountBalances();

    OrderBookDto getOrderBook(String pair);

    String placeLimitOrder(String pair, OrderSide side, BigDecimal quantity, BigDecimal price, boolean postOnly);

    /**
     * Market order. {@code amount} is the quote amount to spend for BUY and the base quantity to sell
     * for SELL.
     */
    String placeMarketOrder(String pair, OrderSide side, BigDecimal amount);

    String placeStopLimitOrder(
            String pair,
            OrderSide side,
            BigDecimal quantity,
            BigDecimal stopPrice,
            BigDecimal limitPrice
    );

    void cancelOrder(String pair, String orderId);

    OrderStatusDto getOrderStatus(String pair, String orderId);

    List<OpenOrderDto> getOpenOrders();

    List<FillDto> getOrderFills(String pair, String orderId);
}
