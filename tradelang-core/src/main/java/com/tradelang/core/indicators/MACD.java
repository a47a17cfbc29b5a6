package com.tradelang.core.indicators;

/**
 * Moving Average Convergence Divergence.
 */
public final class MACD {

    private MACD() {}

    public record Result(double[] line, double[] signal, double[] histogram) {}

    public static Result calculate(double[] series, int fastPeriod, int slowPeriod, int signalPeriod) {
        int n = series.length;
        double[] fast = EMA.calculate(series, fastPeriod);
        double[] slow = EMA.calculate(series, slowPeriod);

        double[] line = new double[n];
        for (int i = 0; i < n; i++) {
            line[i] = fast[i] - slow[i];
        }

        double[] signal = EMA.calculate(line, signalPeriod);

        double[] histogram = new double[n];
        for (int i = 0; i < n; i++) {
            histogram[i] = line[i] - signal[i];
        }

        return new Result(line, signal, histogram);
    }
}
