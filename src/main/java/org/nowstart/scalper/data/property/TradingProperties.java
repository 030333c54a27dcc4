package org.nowstart.scalper.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.nowstart.scalper.data.type.EntryPricing;
import org.nowstart.scalper.data.type.ProtectionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scalper.trading")
public record TradingProperties(
        // 자동매매 대상 페어 목록
        @NotEmpty @DefaultValue({"BTCZAR", "ETHZAR"}) List<String> pairs,
        // RSI 매수 신호 임계값 (이 값 미만이면 매수)
        @DecimalMin("0") @DecimalMax("100") @DefaultValue("45") BigDecimal signalThreshold,
        // RSI 기간
        @Positive @DefaultValue("14") int rsiPeriod,
        // 같은 페어의 연속 신호 최소 간격
        @NotNull @DefaultValue("5m") Duration signalCooldown,
        // 익절 비율(%)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.5") BigDecimal takeProfitPct,
        // 손절 비율(%)
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "100", inclusive = false)
        @DefaultValue("2.0") BigDecimal stopLossPct,
        // 1회 진입 금액(호가 통화 기준)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("100") BigDecimal baseTradeAmount,
        // 일일 최대 거래 횟수 (UTC 기준)
        @Positive @DefaultValue("20") int maxDailyTrades,
        // 테이커 수수료율(예: 0.001 = 0.1%)
        @DecimalMin("0") @DefaultValue("0.001") BigDecimal takerFeeRate,
        // 잔고 확인 시 추가 여유분(%)
        @DecimalMin("0") @DefaultValue("0.5") BigDecimal balanceSafetyMarginPct,
        // 진입 주문 체결 대기 한도
        @NotNull @DefaultValue("60s") Duration entryFillTimeout,
        // 포지션 최대 보유 시간
        @NotNull @DefaultValue("60m") Duration positionTimeout,
        // 청산 주문 미체결 허용 시간
        @NotNull @DefaultValue("45m") Duration exitOrderTimeout,
        // 진입 가격 결정 방식
        @NotNull @DefaultValue("ASK_CROSS") EntryPricing entryPricing,
        // 보호 주문 배치 방식
        @NotNull @DefaultValue("BOTH") ProtectionMode protectionMode,
        // 신호 스캔 주기
        @NotNull @DefaultValue("60s") Duration scanInterval,
        // 포지션 모니터링 주기
        @NotNull @DefaultValue("15s") Duration monitorInterval,
        // 오래된 주문 기록 정리 기준
        @NotNull @DefaultValue("24h") Duration staleOrderAge,
        // 포지션/주문 JSON 저장 디렉터리
        @NotBlank @DefaultValue("data") String dataDirectory,
        // 페어별 설정이 없을 때 사용할 정밀도
        @Valid @NotNull @DefaultValue PairPrecision defaultPrecision,
        // 페어별 가격/수량 정밀도
        @Valid @NotNull @DefaultValue Map<String, PairPrecision> precision
) {

    public PairPrecision precisionFor(String pair) {
        if (precision == null || pair == null) {
            return defaultPrecision;
        }
        // 바인딩 시 맵 키 대소문자가 바뀔 수 있어 대소문자 무시 비교
        return precision.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(pair))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(defaultPrecision);
    }

    public record PairPrecision(
            // 가격 소수 자릿수
            @Min(0) @DefaultValue("6") int priceDecimals,
            // 수량 소수 자릿수
            @Min(0) @DefaultValue("8") int quantityDecimals,
            // 호가 단위 (없으면 가격 소수 자릿수로 계산)
            BigDecimal tickSize
    ) {

        public BigDecimal effectiveTickSize() {
            if (tickSize != null && tickSize.signum() > 0) {
                return tickSize;
            }
            return BigDecimal.ONE.movePointLeft(priceDecimals);
        }
    }
}
