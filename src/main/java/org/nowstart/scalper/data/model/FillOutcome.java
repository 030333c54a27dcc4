package org.nowstart.scalper.data.model;

import java.math.BigDecimal;
import org.nowstart.scalper.data.type.FillState;

public record FillOutcome(
        FillState state,
        BigDecimal filledQuantity,
        BigDecimal averagePrice
) {

    public static FillOutcome filled(BigDecimal quantity, BigDecimal averagePrice) {
        return new FillOutcome(FillState.FILLED, quantity, averagePrice);
    }

    public static FillOutcome partiallyFilled(BigDecimal quantity, BigDecimal averagePrice) {
        return new FillOutcome(FillState.PARTIALLY_FILLED, quantity, averagePrice);
    }

    public static FillOutcome unfilled(FillState state) {
        return new FillOutcome(state, BigDecimal.ZERO, null);
    }

    public boolean hasFill() {
        return (state == FillState.FILLED || state == FillState.PARTIALLY_FILLED)
                && filledQuantity != null
                && filledQuantity.signum() > 0;
    }
}
