package org.nowstart.scalper.data.property;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scalper.valr")
public record ValrProperties(
        // VALR REST API 기본 URL
        @NotBlank @DefaultValue("https://api.valr.com") String baseUrl,
        // VALR API Key
        @DefaultValue("") String apiKey,
        // VALR API Secret (HMAC-SHA512 서명용)
        @DefaultValue("") String apiSecret,
        // 429/5xx/전송 오류 재시도 횟수
        @Min(0) @DefaultValue("3") int maxRetries,
        // 재시도 기본 대기 시간 (시도마다 2배)
        @NotNull @DefaultValue("2s") Duration retryBackoff,
        // 재시도 대기 상한
        @NotNull @DefaultValue("30s") Duration maxBackoff,
        // 분당 최대 요청 수 (60초 슬라이딩 윈도우)
        @Positive @DefaultValue("600") int rateLimitPerMinute,
        // 연결 타임아웃
        @NotNull @DefaultValue("10s") Duration connectTimeout,
        // 응답 타임아웃
        @NotNull @DefaultValue("30s") Duration readTimeout
) {
}
