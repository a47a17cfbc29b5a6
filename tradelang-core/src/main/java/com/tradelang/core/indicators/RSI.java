package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Relative Strength Index using simple rolling means of gains and losses.
 */
public final class RSI {

    private RSI() {}

    /**
     * RSI = 100 - 100 / (1 + RS), RS = mean gain / mean loss over the trailing
     * {@code period} bar-to-bar changes. The first bar counts as an unchanged bar.
     * A window with neither gains nor losses is undefined; a window without
     * losses is 100.
     */
    public static double[] calculate(double[] series, int period) {
        int n = series.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(series[i])) {
                gains[i] = Double.NaN;
                losses[i] = Double.NaN;
            } else if (i == 0) {
                gains[i] = 0;
                losses[i] = 0;
            } else {
                double delta = series[i] - series[i - 1];
                gains[i] = delta > 0 ? delta : (Double.isNaN(delta) ? Double.NaN : 0);
                losses[i] = delta < 0 ? -delta : (Double.isNaN(delta) ? Double.NaN : 0);
            }
        }

        double[] avgGain = SMA.calculate(gains, period);
        double[] avgLoss = SMA.calculate(losses, period);

        for (int i = 0; i < n; i++) {
            double gain = avgGain[i];
            double loss = avgLoss[i];
            if (Double.isNaN(gain) || Double.isNaN(loss)) {
                continue;
            }
            if (loss == 0) {
                result[i] = gain == 0 ? Double.NaN : 100.0;
            } else {
                result[i] = 100.0 - 100.0 / (1.0 + gain / loss);
            }
        }

        return result;
    }
}
