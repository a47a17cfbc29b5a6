package com.tradelang.core.indicators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for indicator values and warm-up behaviour.
 */
class IndicatorsTest {

    private static final double EPS = 1e-9;
    private static final double[] RISING = {1, 2, 3, 4, 5};

    private static void assertUndefined(double value) {
        assertTrue(Double.isNaN(value), "expected NaN but was " + value);
    }

    @Nested
    @DisplayName("Moving averages")
    class MovingAverageTests {

        @Test
        @DisplayName("SMA is undefined until the window is full")
        void smaWarmup() {
            double[] sma = SMA.calculate(RISING, 3);

            assertUndefined(sma[0]);
            assertUndefined(sma[1]);
            assertEquals(2.0, sma[2], EPS);
            assertEquals(3.0, sma[3], EPS);
            assertEquals(4.0, sma[4], EPS);
        }

        @Test
        @DisplayName("SMA window containing an undefined value is undefined")
        void smaSkipsUndefinedWindows() {
            double[] sma = SMA.calculate(new double[] {Double.NaN, 2, 4, 6}, 2);

            assertUndefined(sma[1]);
            assertEquals(3.0, sma[2], EPS);
            assertEquals(5.0, sma[3], EPS);
        }

        @Test
        @DisplayName("SMA longer than the series is all undefined")
        void smaTooShort() {
            for (double v : SMA.calculate(RISING, 20)) {
                assertUndefined(v);
            }
        }

        @Test
        @DisplayName("EMA seeds with the first value and reports after period values")
        void ema() {
            double[] ema = EMA.calculate(RISING, 3);

            assertUndefined(ema[0]);
            assertUndefined(ema[1]);
            assertEquals(2.25, ema[2], EPS);
            assertEquals(3.125, ema[3], EPS);
            assertEquals(4.0625, ema[4], EPS);
        }

        @Test
        @DisplayName("EMA over a warming-up input starts at its first defined value")
        void emaOfWarmingSeries() {
            double[] ema = EMA.calculate(new double[] {Double.NaN, Double.NaN, 4, 4, 4}, 2);

            assertUndefined(ema[2]);
            assertEquals(4.0, ema[3], EPS);
            assertEquals(4.0, ema[4], EPS);
        }
    }

    @Nested
    @DisplayName("Oscillators")
    class OscillatorTests {

        @Test
        @DisplayName("RSI from rolling mean gains and losses")
        void rsi() {
            double[] rsi = RSI.calculate(new double[] {1, 2, 3, 2, 3}, 3);

            assertUndefined(rsi[0]);
            assertUndefined(rsi[1]);
            assertEquals(100.0, rsi[2], EPS);
            assertEquals(100.0 - 100.0 / 3.0, rsi[3], EPS);
            assertEquals(100.0 - 100.0 / 3.0, rsi[4], EPS);
        }

        @Test
        @DisplayName("RSI of a flat window is undefined")
        void rsiFlat() {
            for (double v : RSI.calculate(new double[] {5, 5, 5, 5, 5}, 3)) {
                assertUndefined(v);
            }
        }

        @Test
        @DisplayName("RSI with only losses is zero")
        void rsiAllLosses() {
            double[] rsi = RSI.calculate(new double[] {5, 4, 3, 2}, 3);

            assertEquals(0.0, rsi[3], EPS);
        }

        @Test
        @DisplayName("Stochastic %K at the top of the range is 100")
        void stochastic() {
            Stochastic.Result r = Stochastic.calculate(
                new double[] {3, 4, 5}, new double[] {1, 2, 3}, new double[] {2, 3, 5}, 3, 1);

            assertUndefined(r.k()[1]);
            assertEquals(100.0, r.k()[2], EPS);
            assertEquals(100.0, r.d()[2], EPS);
        }

        @Test
        @DisplayName("Stochastic over a flat range is undefined")
        void stochasticFlat() {
            double[] flat = {2, 2, 2};
            Stochastic.Result r = Stochastic.calculate(flat, flat, flat, 2, 1);

            assertUndefined(r.k()[1]);
            assertUndefined(r.k()[2]);
        }
    }

    @Nested
    @DisplayName("Other indicators")
    class OtherIndicatorTests {

        @Test
        @DisplayName("prev shifts by n bars")
        void prev() {
            double[] prev = Prev.calculate(new double[] {1, 2, 3}, 1);

            assertUndefined(prev[0]);
            assertEquals(1.0, prev[1], EPS);
            assertEquals(2.0, prev[2], EPS);
        }

        @Test
        @DisplayName("ATR averages the true range")
        void atr() {
            double[] atr = ATR.calculate(
                new double[] {10, 12, 11}, new double[] {8, 9, 9}, new double[] {9, 11, 10}, 2);

            assertUndefined(atr[0]);
            assertEquals(2.5, atr[1], EPS);
            assertEquals(2.5, atr[2], EPS);
        }

        @Test
        @DisplayName("Bollinger bands use sample standard deviation")
        void bollinger() {
            BollingerBands.Result r = BollingerBands.calculate(RISING, 3, 2.0);

            assertUndefined(r.upper()[1]);
            assertEquals(2.0, r.middle()[2], EPS);
            assertEquals(4.0, r.upper()[2], EPS);
            assertEquals(0.0, r.lower()[2], EPS);
        }

        @Test
        @DisplayName("MACD of a constant series is zero once defined")
        void macdConstant() {
            double[] series = new double[40];
            Arrays.fill(series, 50.0);

            MACD.Result r = MACD.calculate(series, 12, 26, 9);

            assertUndefined(r.line()[24]);
            assertEquals(0.0, r.line()[25], EPS);
            assertUndefined(r.signal()[32]);
            assertEquals(0.0, r.signal()[33], EPS);
            assertEquals(0.0, r.histogram()[39], EPS);
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("Omitted parameters take defaults")
        void defaults() {
            double[] series = new double[30];
            for (int i = 0; i < series.length; i++) {
                series[i] = 100 + Math.sin(i) * 5;
            }

            IndicatorResult result = Indicators.compute(IndicatorKind.RSI, List.of(series), List.of());

            assertArrayEquals(RSI.calculate(series, 14), result.primary());
        }

        @Test
        @DisplayName("Periods are truncated to integers")
        void periodTruncation() {
            IndicatorResult result = Indicators.compute(IndicatorKind.SMA, List.of(RISING), List.of(3.7));

            assertArrayEquals(SMA.calculate(RISING, 3), result.output("value"));
        }

        @Test
        @DisplayName("Missing required parameter fails")
        void missingRequired() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Indicators.compute(IndicatorKind.SMA, List.of(RISING), List.of()));

            assertTrue(e.getMessage().contains("period"));
        }

        @Test
        @DisplayName("Multi-output results are addressed by name")
        void namedOutputs() {
            IndicatorResult result = Indicators.compute(IndicatorKind.BOLLINGER, List.of(RISING), List.of(3.0));

            assertEquals(4.0, result.output("upper")[2], EPS);
            assertThrows(IllegalArgumentException.class, () -> result.output("width"));
        }

        @Test
        @DisplayName("Inputs are not modified")
        void inputsUntouched() {
            double[] series = {1, 2, 3, 4, 5};

            for (IndicatorKind kind : IndicatorKind.values()) {
                List<double[]> inputs = kind.seriesCount() == 1
                    ? List.of(series)
                    : List.of(series, series, series);
                List<Double> params = kind.params().stream()
                    .map(p -> p.required() ? 2.0 : p.defaultValue())
                    .toList();
                Indicators.compute(kind, inputs, params);
            }

            assertArrayEquals(new double[] {1, 2, 3, 4, 5}, series);
        }

        @Test
        @DisplayName("Arity bounds come from the registry")
        void arity() {
            assertEquals(2, IndicatorKind.SMA.minArgs());
            assertEquals(2, IndicatorKind.SMA.maxArgs());
            assertEquals(3, IndicatorKind.ATR.minArgs());
            assertEquals(4, IndicatorKind.ATR.maxArgs());
            assertEquals(1, IndicatorKind.MACD.minArgs());
            assertEquals(4, IndicatorKind.MACD.maxArgs());
        }

        @Test
        @DisplayName("Registry defaults drive every multi-parameter indicator")
        void registryDefaults() {
            double[] series = new double[60];
            for (int i = 0; i < series.length; i++) {
                series[i] = 50 + Math.cos(i / 3.0) * 4;
            }
            double[] low = Arrays.stream(series).map(v -> v - 1).toArray();

            IndicatorResult macd = Indicators.compute(IndicatorKind.MACD, List.of(series), List.of());
            assertArrayEquals(MACD.calculate(series, 12, 26, 9).histogram(), macd.output("histogram"));

            IndicatorResult bands = Indicators.compute(IndicatorKind.BOLLINGER, List.of(series), List.of());
            assertArrayEquals(BollingerBands.calculate(series, 20, 2.0).upper(), bands.output("upper"));

            IndicatorResult stoch = Indicators.compute(IndicatorKind.STOCHASTIC,
                List.of(series, low, series), List.of());
            assertArrayEquals(Stochastic.calculate(series, low, series, 14, 3).d(), stoch.output("d"));

            IndicatorResult atr = Indicators.compute(IndicatorKind.ATR, List.of(series, low, series), List.of());
            assertArrayEquals(ATR.calculate(series, low, series, 14), atr.primary());
        }

        @Test
        @DisplayName("Signatures bracket the optional parameters")
        void signatures() {
            assertEquals("sma(series, period)", IndicatorKind.SMA.signature());
            assertEquals("prev(series[, n])", IndicatorKind.PREV.signature());
            assertEquals("macd(series[, fast, slow, signal])", IndicatorKind.MACD.signature());
            assertEquals("atr(high, low, close[, period])", IndicatorKind.ATR.signature());
        }
    }
}
