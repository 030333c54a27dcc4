package org.nowstart.scalper.service.signal;

import java.util.Arrays;
import org.springframework.stereotype.Service;

@Service
public class SignalComputationService {

    /**
     * Wilder-smoothed RSI. Entries before the first full period are NaN.
     */
    public double[] wilderRsi(double[] close, int period) {
        int n = close.length;
        double[] rsi = fillNaN(n);
        if (period <= 0 || n <= period) {
            return rsi;
        }

        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = close[i] - close[i - 1];
            if (change > 0) {
                gainSum += change;
            } else {
                lossSum -= change;
            }
        }

        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;
        rsi[period] = toRsi(avgGain, avgLoss);
        for (int i = period + 1; i < n; i++) {
            double change = close[i] - close[i - 1];
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
            rsi[i] = toRsi(avgGain, avgLoss);
        }
        return rsi;
    }

    private double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double relativeStrength = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + relativeStrength));
    }

    private double[] fillNaN(int n) {
        double[] values = new double[n];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
