package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Stochastic Oscillator (%K and %D).
 */
public final class Stochastic {

    private Stochastic() {}

    public record Result(double[] k, double[] d) {}

    /**
     * %K = 100 * (close - lowest low) / (highest high - lowest low) over {@code kPeriod}
     * bars, %D = SMA(%K, {@code dPeriod}). A flat window is undefined.
     */
    public static Result calculate(double[] high, double[] low, double[] close, int kPeriod, int dPeriod) {
        int n = close.length;
        double[] k = new double[n];
        Arrays.fill(k, Double.NaN);

        if (kPeriod > 0) {
            for (int i = kPeriod - 1; i < n; i++) {
                double highest = Double.NEGATIVE_INFINITY;
                double lowest = Double.POSITIVE_INFINITY;
                boolean complete = true;

                for (int j = i - kPeriod + 1; j <= i; j++) {
                    if (Double.isNaN(high[j]) || Double.isNaN(low[j])) {
                        complete = false;
                        break;
                    }
                    highest = Math.max(highest, high[j]);
                    lowest = Math.min(lowest, low[j]);
                }

                double range = highest - lowest;
                if (complete && range != 0) {
                    k[i] = 100.0 * (close[i] - lowest) / range;
                }
            }
        }

        double[] d = SMA.calculate(k, dPeriod);
        return new Result(k, d);
    }
}
