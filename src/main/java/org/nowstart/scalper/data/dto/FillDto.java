package org.nowstart.scalper.data.dto;

import java.math.BigDecimal;

public record FillDto(
        String orderId,
        BigDecimal price,
        BigDecimal quantity
) {
}
