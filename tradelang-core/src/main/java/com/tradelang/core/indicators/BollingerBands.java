package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Bollinger Bands: SMA middle band with bands at k sample standard deviations.
 */
public final class BollingerBands {

    private BollingerBands() {}

    public record Result(double[] middle, double[] upper, double[] lower) {}

    public static Result calculate(double[] series, int period, double stdDevMultiplier) {
        int n = series.length;
        double[] middle = SMA.calculate(series, period);
        double[] upper = new double[n];
        double[] lower = new double[n];
        Arrays.fill(upper, Double.NaN);
        Arrays.fill(lower, Double.NaN);

        // Sample deviation needs at least two points
        if (period < 2) {
            return new Result(middle, upper, lower);
        }

        for (int i = period - 1; i < n; i++) {
            if (Double.isNaN(middle[i])) {
                continue;
            }
            double mean = middle[i];
            double sumSq = 0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = series[j] - mean;
                sumSq += diff * diff;
            }
            double stdDev = Math.sqrt(sumSq / (period - 1));

            upper[i] = mean + stdDevMultiplier * stdDev;
            lower[i] = mean - stdDevMultiplier * stdDev;
        }

        return new Result(middle, upper, lower);
    }
}
