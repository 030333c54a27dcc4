package org.nowstart.scalper.service.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SignalComputationServiceTest {

    private final SignalComputationService service = new SignalComputationService();

    @Test
    void wilderRsi_isNaNBeforeFirstPeriod() {
        double[] rsi = service.wilderRsi(new double[]{1, 2, 3}, 3);

        assertThat(rsi).hasSize(3);
        for (double value : rsi) {
            assertThat(value).isNaN();
        }
    }

    @Test
    void wilderRsi_handlesOneSidedSeries() {
        assertThat(service.wilderRsi(new double[]{5, 4, 3, 2, 1}, 3)[4]).isEqualTo(0.0);
        assertThat(service.wilderRsi(new double[]{1, 2, 3, 4, 5}, 3)[4]).isEqualTo(100.0);
        assertThat(service.wilderRsi(new double[]{2, 2, 2, 2}, 3)[3]).isEqualTo(50.0);
    }

    @Test
    void wilderRsi_smoothsMixedMoves() {
        double[] rsi = service.wilderRsi(new double[]{10, 11, 10, 11, 10}, 2);

        assertThat(rsi[2]).isCloseTo(50.0, within(1e-9));
        assertThat(rsi[3]).isCloseTo(75.0, within(1e-9));
        assertThat(rsi[4]).isCloseTo(37.5, within(1e-9));
    }
}
