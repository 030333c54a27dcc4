package org.nowstart.scalper.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.scalper.data.dto.PositionCloseResponse;
import org.nowstart.scalper.data.dto.SignalExecuteRequest;
import org.nowstart.scalper.data.dto.TradeSetupResponse;
import org.nowstart.scalper.data.exception.PositionNotFoundException;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.model.TradeSetupResult;
import org.nowstart.scalper.data.type.CloseReason;
import org.nowstart.scalper.data.type.NoTradeReason;
import org.nowstart.scalper.repository.ValrGateway;
import org.nowstart.scalper.service.PositionCloseService;
import org.nowstart.scalper.service.TradingAuditService;
import org.nowstart.scalper.service.TradingSignalWorkflowService;
import org.nowstart.scalper.service.TradingStateService;
import org.nowstart.scalper.support.Positions;

@ExtendWith(MockitoExtension.class)
class TradingControllerTest {

    @Mock
    private TradingStateService tradingStateService;
    @Mock
    private TradingSignalWorkflowService tradingSignalWorkflowService;
    @Mock
    private PositionCloseService positionCloseService;
    @Mock
    private TradingAuditService tradingAuditService;
    @Mock
    private ValrGateway valrGateway;

    @InjectMocks
    private TradingController controller;

    @Test
    void getBalances_delegatesToGateway() {
        Map<String, BigDecimal> balances = Map.of("ZAR", new BigDecimal("1500"));
        when(valrGateway.getAccountBalances()).thenReturn(balances);

        assertThat(controller.getBalances()).isEqualTo(balances);
    }

    @Test
    void executeSignal_mapsOpenedPosition() {
        Position position = Positions.open("BTCZAR_1", Instant.parse("2026-03-01T10:00:00Z")).build();
        when(tradingSignalWorkflowService.executeManualSignal("BTCZAR")).thenReturn(TradeSetupResult.opened(position));

        TradeSetupResponse response = controller.executeSignal(new SignalExecuteRequest("BTCZAR"));

        assertThat(response.opened()).isTrue();
        assertThat(response.position()).isSameAs(position);
        assertThat(response.reason()).isNull();
    }

    @Test
    void executeSignal_mapsNoTradeReason() {
        when(tradingSignalWorkflowService.executeManualSignal("BTCZAR"))
                .thenReturn(TradeSetupResult.noTrade(NoTradeReason.DAILY_LIMIT_REACHED, "daily trade limit reached"));

        TradeSetupResponse response = controller.executeSignal(new SignalExecuteRequest("BTCZAR"));

        assertThat(response.opened()).isFalse();
        assertThat(response.reason()).isEqualTo("DAILY_LIMIT_REACHED");
        assertThat(response.detail()).isEqualTo("daily trade limit reached");
    }

    @Test
    void closePosition_forceClosesActivePosition() {
        Position position = Positions.open("BTCZAR_1", Instant.parse("2026-03-01T10:00:00Z")).build();
        when(tradingStateService.findPosition("BTCZAR_1")).thenReturn(Optional.of(position));
        when(positionCloseService.forceClose("BTCZAR_1", CloseReason.MANUAL)).thenReturn(true);

        PositionCloseResponse response = controller.closePosition("BTCZAR_1");

        assertThat(response).isEqualTo(new PositionCloseResponse("BTCZAR_1", true));
    }

    @Test
    void closePosition_throwsNotFoundForUnknownPosition() {
        when(tradingStateService.findPosition("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.closePosition("missing"))
                .isInstanceOf(PositionNotFoundException.class)
                .hasMessageContaining("missing");
        verifyNoInteractions(positionCloseService);
    }

    @Test
    void getPositionsAndAuditEvents_delegate() {
        when(tradingStateService.openPositions()).thenReturn(List.of());
        when(tradingAuditService.recentEvents()).thenReturn(List.of());

        assertThat(controller.getPositions()).isEmpty();
        assertThat(controller.getAuditEvents()).isEmpty();
        verify(tradingAuditService).recentEvents();
    }
}
