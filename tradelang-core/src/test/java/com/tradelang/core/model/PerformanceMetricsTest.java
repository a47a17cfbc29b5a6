package com.tradelang.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMetricsTest {

    private static final double EPS = 1e-9;

    private static Trade trade(double entry, double exit, double shares) {
        return Trade.close(new Position(0, 0L, entry, shares, entry * shares), 1, 1L, exit);
    }

    @Nested
    @DisplayName("Boundaries")
    class BoundaryTests {

        @Test
        @DisplayName("No trades gives neutral metrics")
        void noTrades() {
            PerformanceMetrics m = PerformanceMetrics.calculate(List.of(), 10_000, 10_500, -0.05, 252);

            assertEquals(0, m.totalTrades());
            assertEquals(0, m.winRate());
            assertEquals(0, m.profitFactor());
            assertEquals(0, m.sharpeRatio());
            assertEquals(10_000, m.finalEquity());
            assertEquals(10_000, m.initialEquity());
            assertEquals(-5.0, m.maxDrawdownPercent(), EPS);
        }

        @Test
        @DisplayName("Only winners gives infinite profit factor")
        void onlyWinners() {
            PerformanceMetrics m = PerformanceMetrics.calculate(
                List.of(trade(100, 110, 100)), 10_000, 11_000, 0, 252);

            assertEquals(Double.POSITIVE_INFINITY, m.profitFactor());
            assertEquals(100.0, m.winRate(), EPS);
            assertEquals(0, m.sharpeRatio());
        }

        @Test
        @DisplayName("Break-even trades are neither winners nor losers")
        void breakEven() {
            PerformanceMetrics m = PerformanceMetrics.calculate(
                List.of(trade(100, 100, 100)), 10_000, 10_000, 0, 252);

            assertEquals(1, m.totalTrades());
            assertEquals(0, m.winningTrades());
            assertEquals(0, m.losingTrades());
            assertEquals(0, m.profitFactor());
        }

        @Test
        @DisplayName("Identical returns have no dispersion")
        void noDispersion() {
            PerformanceMetrics m = PerformanceMetrics.calculate(
                List.of(trade(100, 110, 1), trade(50, 55, 1)), 10_000, 10_015, 0, 252);

            assertEquals(0, m.sharpeRatio());
        }
    }

    @Test
    @DisplayName("Mixed trades")
    void mixedTrades() {
        Trade win = trade(100, 200, 100);   // +100%
        Trade loss = trade(100, 50, 200);   // -50%

        PerformanceMetrics m = PerformanceMetrics.calculate(List.of(win, loss), 10_000, 10_000, -0.5, 252);

        assertEquals(2, m.totalTrades());
        assertEquals(50.0, m.winRate(), EPS);
        assertEquals(25.0, m.averageReturn(), EPS);
        assertEquals(100.0, m.averageWin(), EPS);
        assertEquals(-50.0, m.averageLoss(), EPS);
        assertEquals(1.0, m.profitFactor(), EPS);
        assertEquals(25.0 / 75.0 * Math.sqrt(126), m.sharpeRatio(), EPS);
        assertEquals(0, m.totalReturn(), EPS);
        assertEquals(-50.0, m.maxDrawdownPercent(), EPS);
    }

    @Test
    @DisplayName("Trade return is percent of the fractional pnl")
    void tradeReturn() {
        Trade t = trade(50, 60, 200);

        assertEquals(2000, t.pnl(), EPS);
        assertEquals(0.2, t.pnlPercent(), EPS);
        assertEquals(20.0, t.returnPercent(), EPS);
    }
}
