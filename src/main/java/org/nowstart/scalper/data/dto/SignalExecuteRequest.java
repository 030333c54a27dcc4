package org.nowstart.scalper.data.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record SignalExecuteRequest(
        @Schema(description = "거래 페어", example = "BTCZAR")
        @NotBlank String pair
) {
}
