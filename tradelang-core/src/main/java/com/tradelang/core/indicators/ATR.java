package com.tradelang.core.indicators;

import java.util.Arrays;

/**
 * Average True Range, the simple average of true range over {@code period} bars.
 */
public final class ATR {

    private ATR() {}

    public static double[] calculate(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] tr = new double[n];
        Arrays.fill(tr, Double.NaN);

        if (n == 0) {
            return tr;
        }

        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);

            tr[i] = maxDefined(highLow, maxDefined(highPrevClose, lowPrevClose));
        }

        return SMA.calculate(tr, period);
    }

    private static double maxDefined(double a, double b) {
        if (Double.isNaN(a)) {
            return b;
        }
        if (Double.isNaN(b)) {
            return a;
        }
        return Math.max(a, b);
    }
}
