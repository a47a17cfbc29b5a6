package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Exponential Moving Average with span {@code period} (alpha = 2 / (period + 1)).
 */
public final class EMA {

    private EMA() {}

    /**
     * The average is seeded with the first defined value and reported once
     * {@code period} defined values have been seen. Undefined inputs after the
     * seed carry the previous average forward.
     */
    public static double[] calculate(double[] series, int period) {
        int n = series.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0) {
            return result;
        }

        double alpha = 2.0 / (period + 1);
        double ema = Double.NaN;
        int seen = 0;

        for (int i = 0; i < n; i++) {
            double value = series[i];
            if (!Double.isNaN(value)) {
                ema = Double.isNaN(ema) ? value : alpha * value + (1 - alpha) * ema;
                seen++;
            }
            if (seen >= period) {
                result[i] = ema;
            }
        }

        return result;
    }
}
