package com.tradelang.engine;

import com.tradelang.core.dsl.StrategyCompiler;
import com.tradelang.core.model.BacktestConfig;
import com.tradelang.core.model.BacktestResult;
import com.tradelang.core.model.Candle;
import com.tradelang.core.model.PerformanceMetrics;
import com.tradelang.core.model.PriceTable;
import com.tradelang.core.model.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BacktestEngine covering the two-state simulation and its metrics.
 */
class BacktestEngineTest {

    private static final double EPS = 1e-9;
    private static final long DAY = 86_400_000L;

    private BacktestEngine engine;
    private BacktestConfig baseConfig;

    @BeforeEach
    void setUp() {
        engine = new BacktestEngine();
        baseConfig = BacktestConfig.withCapital(10_000);
    }

    // Helper to create candles closing at the given prices
    private static PriceTable table(double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            double c = closes[i];
            candles.add(new Candle(i * DAY, c, c + 1, c - 1, c, 1000.0));
        }
        return PriceTable.of(candles);
    }

    // Helper to create flat candles at a fixed price
    private static PriceTable flat(double price, int count) {
        double[] closes = new double[count];
        Arrays.fill(closes, price);
        return table(closes);
    }

    private static boolean[] at(int length, int... bars) {
        boolean[] signals = new boolean[length];
        for (int bar : bars) {
            signals[bar] = true;
        }
        return signals;
    }

    private static StrategySignals signals(boolean[] entry, boolean[] exit) {
        return new StrategySignals(entry, exit, List.of());
    }

    @Nested
    @DisplayName("State machine")
    class StateMachineTests {

        @Test
        @DisplayName("Entry then exit on a flat series is one break-even trade")
        void entryThenExit() {
            BacktestResult result = engine.run(flat(100, 8), signals(at(8, 2), at(8, 5)), baseConfig);

            assertEquals(1, result.trades().size());
            Trade trade = result.trades().get(0);
            assertEquals(2, trade.entryBar());
            assertEquals(5, trade.exitBar());
            assertEquals(2 * DAY, trade.entryTime());
            assertEquals(5 * DAY, trade.exitTime());
            assertEquals(0, trade.pnl(), EPS);
            for (double equity : result.equityCurve()) {
                assertEquals(10_000, equity, EPS);
            }
        }

        @Test
        @DisplayName("Exit signals are ignored while flat")
        void exitIgnoredWhenFlat() {
            BacktestResult result = engine.run(flat(100, 5), signals(at(5), at(5, 0, 1, 2, 3, 4)), baseConfig);

            assertTrue(result.trades().isEmpty());
            assertNull(result.openPosition());
        }

        @Test
        @DisplayName("Entry signals are ignored while in position")
        void entryIgnoredInPosition() {
            BacktestResult result = engine.run(table(100, 110, 120, 130),
                signals(at(4, 0, 1, 2), at(4, 3)), baseConfig);

            assertEquals(1, result.trades().size());
            assertEquals(0, result.trades().get(0).entryBar());
            assertEquals(100, result.trades().get(0).entryPrice(), EPS);
        }

        @Test
        @DisplayName("Entry and exit on the same bar only enters")
        void noSameBarRoundTripFromFlat() {
            BacktestResult result = engine.run(flat(100, 3), signals(at(3, 1), at(3, 1)), baseConfig);

            assertTrue(result.trades().isEmpty());
            assertNotNull(result.openPosition());
            assertEquals(1, result.openPosition().entryBar());
        }

        @Test
        @DisplayName("Exit bar does not re-enter")
        void noReentryOnExitBar() {
            BacktestResult result = engine.run(flat(100, 4), signals(at(4, 0, 2), at(4, 2)), baseConfig);

            assertEquals(1, result.trades().size());
            assertNull(result.openPosition());
        }

        @Test
        @DisplayName("Signals must match the table length")
        void misalignedSignals() {
            assertThrows(IllegalArgumentException.class,
                () -> engine.run(flat(100, 4), signals(at(3), at(3)), baseConfig));
        }
    }

    @Nested
    @DisplayName("Sizing and equity")
    class SizingTests {

        @Test
        @DisplayName("Full equity is invested at the entry close")
        void fullyInvested() {
            BacktestResult result = engine.run(table(50, 55, 60), signals(at(3, 0), at(3, 2)), baseConfig);

            Trade trade = result.trades().get(0);
            assertEquals(200, trade.shareCount(), EPS);
            assertEquals(2_000, trade.pnl(), EPS);
            assertEquals(0.20, trade.pnlPercent(), EPS);
            assertArrayEquals(new double[] {10_000, 11_000, 12_000}, result.equityCurve(), EPS);
            assertEquals(12_000, result.metrics().finalEquity(), EPS);
        }

        @Test
        @DisplayName("Exit equity is entry equity plus pnl")
        void exitEquityNotDoubleCounted() {
            BacktestResult result = engine.run(table(100, 110, 120), signals(at(3, 0), at(3, 2)), baseConfig);

            assertEquals(12_000, result.equityCurve()[2], EPS);
        }

        @Test
        @DisplayName("Equity compounds across trades")
        void compounding() {
            BacktestResult result = engine.run(table(100, 200, 200, 100, 50),
                signals(at(5, 0, 3), at(5, 1, 4)), baseConfig);

            assertEquals(2, result.trades().size());
            assertEquals(200, result.trades().get(1).shareCount(), EPS);
            assertArrayEquals(new double[] {10_000, 20_000, 20_000, 20_000, 10_000}, result.equityCurve(), EPS);

            PerformanceMetrics m = result.metrics();
            assertEquals(1, m.winningTrades());
            assertEquals(1, m.losingTrades());
            assertEquals(50.0, m.winRate(), EPS);
            assertEquals(1.0, m.profitFactor(), EPS);
            assertEquals(25.0, m.averageReturn(), EPS);
            assertEquals(25.0 / 75.0 * Math.sqrt(252.0 / 2), m.sharpeRatio(), EPS);
            assertEquals(-0.5, m.maxDrawdown(), EPS);
            assertEquals(-50.0, m.maxDrawdownPercent(), EPS);
        }

        @Test
        @DisplayName("Drawdown tracks the running peak")
        void drawdownCurve() {
            BacktestResult result = engine.run(table(100, 120, 90, 110), signals(at(4, 0), at(4)), baseConfig);

            assertArrayEquals(new double[] {0, 0, -0.25, -(12_000 - 11_000) / 12_000.0}, result.drawdownCurve(), EPS);
            assertEquals(-0.25, result.metrics().maxDrawdown(), EPS);
        }

        @Test
        @DisplayName("Position open at the end is reported but not a trade")
        void openPositionAtEnd() {
            BacktestResult result = engine.run(table(100, 120, 90, 110), signals(at(4, 0), at(4)), baseConfig);

            assertTrue(result.trades().isEmpty());
            assertTrue(result.hasOpenPosition());
            assertEquals(100, result.openPosition().shareCount(), EPS);
            assertEquals(11_000, result.equityCurve()[3], EPS);
            // No closed trades: neutral metrics
            assertEquals(0, result.metrics().totalTrades());
            assertEquals(10_000, result.metrics().finalEquity(), EPS);
        }

        @Test
        @DisplayName("Open position after closed trades is marked into final equity")
        void openPositionMarkedIntoFinalEquity() {
            BacktestResult result = engine.run(table(100, 110, 110, 121),
                signals(at(4, 0, 2), at(4, 1)), baseConfig);

            assertEquals(1, result.trades().size());
            assertEquals(12_100, result.metrics().finalEquity(), EPS);
            assertEquals(21.0, result.metrics().totalReturnPercent(), EPS);
        }
    }

    @Nested
    @DisplayName("Undecidable bars")
    class UndecidableTests {

        @Test
        @DisplayName("Null signals carry equity and trigger nothing")
        void nullSignalsCarry() {
            Boolean[] entry = {null, null, true, false, false};
            Boolean[] exit = {null, null, false, null, true};

            BacktestResult result = engine.run(table(100, 100, 100, 150, 200), entry, exit, baseConfig);

            assertArrayEquals(new double[] {10_000, 10_000, 10_000, 10_000, 20_000}, result.equityCurve(), EPS);
            assertEquals(1, result.trades().size());
            assertEquals(2, result.trades().get(0).entryBar());
        }

        @Test
        @DisplayName("Null entry while a true value would enter does nothing")
        void nullEntryDoesNotEnter() {
            Boolean[] entry = {null, null};
            Boolean[] exit = {false, false};

            BacktestResult result = engine.run(flat(100, 2), entry, exit, baseConfig);

            assertNull(result.openPosition());
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("No signals gives neutral metrics and is idempotent")
        void noTrades() {
            PriceTable table = table(100, 90, 80, 120);
            StrategySignals none = signals(at(4), at(4));

            BacktestResult first = engine.run(table, none, baseConfig);
            BacktestResult second = engine.run(table, none, baseConfig);

            assertEquals(0, first.metrics().totalTrades());
            assertEquals(0, first.metrics().totalReturn());
            assertEquals(0, first.metrics().maxDrawdown());
            assertEquals(10_000, first.metrics().finalEquity());
            assertEquals(first.metrics(), second.metrics());
            assertArrayEquals(first.equityCurve(), second.equityCurve());
        }

        @Test
        @DisplayName("Only winning trades gives infinite profit factor")
        void infiniteProfitFactor() {
            BacktestResult result = engine.run(table(100, 110, 100, 120),
                signals(at(4, 0, 2), at(4, 1, 3)), baseConfig);

            assertEquals(2, result.metrics().winningTrades());
            assertEquals(Double.POSITIVE_INFINITY, result.metrics().profitFactor());
            assertEquals(100.0, result.metrics().winRate(), EPS);
        }
    }

    @Nested
    @DisplayName("Array components")
    class ArrayComponentTests {

        @Test
        @DisplayName("Signals copy their inputs and hand out copies")
        void signalsAreCopied() {
            boolean[] entry = at(3, 0);
            boolean[] exit = at(3, 2);
            StrategySignals s = signals(entry, exit);

            entry[1] = true;
            s.exit()[0] = true;

            assertEquals(1, s.entryCount());
            assertArrayEquals(new boolean[] {false, false, true}, s.exit());
            assertEquals(signals(at(3, 0), at(3, 2)), s);
            assertEquals(signals(at(3, 0), at(3, 2)).hashCode(), s.hashCode());
        }

        @Test
        @DisplayName("Result curves cannot be changed through the accessor")
        void curvesAreCopied() {
            BacktestResult result = engine.run(table(100, 200, 150),
                signals(at(3, 0), at(3, 2)), baseConfig);

            result.equityCurve()[1] = 0;
            result.drawdownCurve()[2] = 0;

            assertEquals(20_000, result.equityCurve()[1], EPS);
            assertEquals(-0.25, result.drawdownCurve()[2], EPS);
        }

        @Test
        @DisplayName("Results with equal curves are equal")
        void resultsCompareByContent() {
            BacktestResult result = engine.run(table(100, 110, 120),
                signals(at(3, 0), at(3, 2)), baseConfig);
            BacktestResult copy = new BacktestResult(result.config(), result.trades(), result.equityCurve(),
                result.drawdownCurve(), result.metrics(), result.openPosition(), result.barsProcessed(),
                result.duration());

            assertEquals(result, copy);
            assertEquals(result.hashCode(), copy.hashCode());
        }
    }

    @Test
    @DisplayName("Compiled strategy drives a backtest end to end")
    void endToEnd() {
        StrategyCompiler compiler = new StrategyCompiler();
        ConditionEvaluator evaluator = new ConditionEvaluator();
        PriceTable table = table(10, 9, 8, 9, 10, 11, 12, 11, 10, 9, 8);

        StrategySignals signals = evaluator.evaluate(
            compiler.compile("ENTRY: close crosses_above prev(close) EXIT: close crosses_below prev(close)"), table);
        BacktestResult result = engine.run(table, signals, baseConfig);

        assertEquals(1, result.trades().size());
        Trade trade = result.trades().get(0);
        assertEquals(3, trade.entryBar());
        assertEquals(7, trade.exitBar());
        assertEquals(11.0 / 9.0 - 1, trade.pnlPercent(), EPS);
        assertEquals(11, result.barsProcessed());
    }
}
