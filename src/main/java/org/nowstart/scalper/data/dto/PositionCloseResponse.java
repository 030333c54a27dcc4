package org.nowstart.scalper.data.dto;

public record PositionCloseResponse(
        String positionId,
        boolean closed
) {
}
