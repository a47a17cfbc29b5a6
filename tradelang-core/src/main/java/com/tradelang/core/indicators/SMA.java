package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Simple Moving Average.
 */
public final class SMA {

    private SMA() {}

    /**
     * Trailing mean over {@code period} bars. A bar is defined only when every
     * value in its window is defined.
     */
    public static double[] calculate(double[] series, int period) {
        int n = series.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double sum = 0;
        int defined = 0;
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(series[i])) {
                sum += series[i];
                defined++;
            }
            if (i >= period) {
                double leaving = series[i - period];
                if (!Double.isNaN(leaving)) {
                    sum -= leaving;
                    defined--;
                }
            }
            if (i >= period - 1 && defined == period) {
                result[i] = sum / period;
            }
        }

        return result;
    }
}
