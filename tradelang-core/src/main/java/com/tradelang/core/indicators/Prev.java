package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Value of a series {@code n} bars ago.
 */
public final class Prev {

    private Prev() {}

    public static double[] calculate(double[] series, int n) {
        int length = series.length;
        double[] result = new double[length];
        Arrays.fill(result, Double.NaN);

        if (n < 0) {
            return result;
        }

        for (int i = n; i < length; i++) {
            result[i] = series[i - n];
        }
        return result;
    }
}
