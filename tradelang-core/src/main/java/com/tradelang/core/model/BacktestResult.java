package com.tradelang.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Result of a backtest run. The curves are copied on the way in and out and
 * compared by content.
 *
 * @param trades        closed trades in exit order
 * @param equityCurve   equity per bar, same length as the price table
 * @param drawdownCurve drawdown fraction per bar (0 or negative)
 * @param openPosition  position still open after the last bar, null when flat
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    BacktestConfig config,
    List<Trade> trades,
    double[] equityCurve,
    double[] drawdownCurve,
    PerformanceMetrics metrics,
    Position openPosition,
    int barsProcessed,
    long duration
) {
    public BacktestResult {
        trades = List.copyOf(trades);
        equityCurve = equityCurve.clone();
        drawdownCurve = drawdownCurve.clone();
    }

    @Override
    public double[] equityCurve() {
        return equityCurve.clone();
    }

    @Override
    public double[] drawdownCurve() {
        return drawdownCurve.clone();
    }

    public boolean hasOpenPosition() {
        return openPosition != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BacktestResult other)) return false;
        return barsProcessed == other.barsProcessed
            && duration == other.duration
            && Objects.equals(config, other.config)
            && trades.equals(other.trades)
            && Arrays.equals(equityCurve, other.equityCurve)
            && Arrays.equals(drawdownCurve, other.drawdownCurve)
            && Objects.equals(metrics, other.metrics)
            && Objects.equals(openPosition, other.openPosition);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(config, trades, metrics, openPosition, barsProcessed, duration);
        result = 31 * result + Arrays.hashCode(equityCurve);
        return 31 * result + Arrays.hashCode(drawdownCurve);
    }
}
