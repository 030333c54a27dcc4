package org.nowstart.scalper.data.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.scalper.data.type.PositionStatus;

/**
 * A long exposure on one pair opened by a filled entry and guarded by exit orders on the book.
 * Mutated only while the trading state lock is held.
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Position {

    private String id;

    private String pair;

    private BigDecimal quantity;

    private BigDecimal entryPrice;

    private BigDecimal stopLossPrice;

    private BigDecimal takeProfitPrice;

    private Instant createdAt;

    private Instant entryFilledAt;

    private PositionStatus status;

    private String entryOrderId;

    private String takeProfitOrderId;

    private String stopLossOrderId;
}
