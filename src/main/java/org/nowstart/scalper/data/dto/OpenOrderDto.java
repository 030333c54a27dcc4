package org.nowstart.scalper.data.dto;

import java.math.BigDecimal;
import org.nowstart.scalper.data.type.OrderSide;

public record OpenOrderDto(
        String orderId,
        String pair,
        OrderSide side,
        BigDecimal price,
        BigDecimal quantity
) {
}
