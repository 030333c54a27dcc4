package org.nowstart.scalper.data.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.scalper.data.type.OrderRecordStatus;
import org.nowstart.scalper.data.type.OrderRole;
import org.nowstart.scalper.data.type.OrderSide;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderRecord {

    private String id;

    private String pair;

    private OrderSide side;

    private BigDecimal quantity;

    private BigDecimal price;

    private OrderRole role;

    private OrderRecordStatus status;

    private Instant createdAt;

    private Instant lastUpdated;
}
