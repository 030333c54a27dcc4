package org.nowstart.scalper.data.dto;

import java.math.BigDecimal;

public record PriceLevel(BigDecimal price, BigDecimal quantity) {
}
