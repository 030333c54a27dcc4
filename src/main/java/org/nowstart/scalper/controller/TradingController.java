package org.nowstart.scalper.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.data.dto.PositionCloseResponse;
import org.nowstart.scalper.data.dto.SignalExecuteRequest;
import org.nowstart.scalper.data.dto.TradeSetupResponse;
import org.nowstart.scalper.data.dto.TradingStatusDto;
import org.nowstart.scalper.data.entity.AuditEvent;
import org.nowstart.scalper.data.exception.PositionNotFoundException;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.type.CloseReason;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.service.PositionCloseService;
import org.nowstart.scalper.service.TradingAuditService;
import org.nowstart.scalper.service.TradingSignalWorkflowService;
import org.nowstart.scalper.service.TradingStateService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/trading")
@Tag(name = "Trading", description = "엔진 상태, 포지션, 잔고 조회 및 수동 시그널/청산 API")
public class TradingController {

    private final TradingStateService tradingStateService;
    private final TradingSignalWorkflowService tradingSignalWorkflowService;
    private final PositionCloseService positionCloseService;
    private final TradingAuditService tradingAuditService;
    private final ValrGateway valrGateway;

    @GetMapping("/status")
    @Operation(summary = "엔진 상태 조회", description = "UTC 기준 일일 거래 횟수, 승/패, 손익과 활성 포지션 수를 조회합니다.")
    public TradingStatusDto getStatus() {
        return tradingStateService.status();
    }

    @GetMapping("/positions")
    @Operation(summary = "활성 포지션 조회")
    public List<Position> getPositions() {
        return tradingStateService.openPositions();
    }

    @GetMapping("/balances")
    @Operation(summary = "잔고 조회", description = "VALR 계정의 통화별 사용 가능 잔고를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "502", description = "거래소 오류")
    })
    public Map<String, BigDecimal> getBalances() {
        return valrGateway.getAccountBalances();
    }

    @PostMapping("/signals")
    @Operation(summary = "수동 시그널 실행", description = "지정한 페어에 대해 즉시 진입을 시도합니다. 진입하지 않은 경우 사유를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "실행 완료"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public TradeSetupResponse executeSignal(@RequestBody @Valid SignalExecuteRequest request) {
        return TradeSetupResponse.from(tradingSignalWorkflowService.executeManualSignal(request.pair()));
    }

    @PostMapping("/positions/{positionId}/close")
    @Operation(summary = "포지션 강제 청산", description = "청산 주문을 취소하고 남은 수량을 시장가로 매도합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "청산 요청 완료"),
            @ApiResponse(responseCode = "404", description = "포지션 없음")
    })
    public PositionCloseResponse closePosition(@PathVariable String positionId) {
        if (tradingStateService.findPosition(positionId).isEmpty()) {
            throw new PositionNotFoundException(positionId);
        }
        boolean closed = positionCloseService.forceClose(positionId, CloseReason.MANUAL);
        return new PositionCloseResponse(positionId, closed);
    }

    @GetMapping("/audit-events")
    @Operation(summary = "감사 이벤트 조회", description = "최근 100건의 거래 감사 이벤트를 조회합니다.")
    public List<AuditEvent> getAuditEvents() {
        return tradingAuditService.recentEvents();
    }
}
