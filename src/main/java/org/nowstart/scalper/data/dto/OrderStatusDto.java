package org.nowstart.scalper.data.dto;

import java.math.BigDecimal;
import org.nowstart.scalper.data.type.ExchangeOrderStatus;

public record OrderStatusDto(
        String orderId,
        ExchangeOrderStatus status,
        String rawStatus,
        BigDecimal originalQuantity,
        BigDecimal filledQuantity,
        BigDecimal averagePrice
) {
}
