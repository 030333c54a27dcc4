package org.nowstart.scalper.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ValrServerTimeResponse(
        long epochTime,
        String time
) {
}
