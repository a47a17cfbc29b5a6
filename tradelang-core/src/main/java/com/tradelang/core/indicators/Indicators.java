package com.tradelang.core.indicators;

import java.util.ArrayList;
import java.util.List;

/**
 * Facade for technical indicator calculations.
 * Delegates to individual indicator classes for cleaner organization.
 * All series are aligned by bar index. Invalid values (warmup period) are Double.NaN.
 * Inputs are never modified.
 */
public final class Indicators {

    private Indicators() {} // Utility class

    /**
     * Compute an indicator from its series arguments and the numeric parameters
     * given in the strategy text. Missing optional parameters take their defaults;
     * period-like parameters are truncated to integers.
     *
     * @throws IllegalArgumentException on a wrong number of series or parameters,
     *                                  or series of different lengths
     */
    public static IndicatorResult compute(IndicatorKind kind, List<double[]> series, List<Double> params) {
        if (series.size() != kind.seriesCount()) {
            throw new IllegalArgumentException(kind.id() + " expects " + kind.seriesCount()
                + " series, got " + series.size());
        }
        int length = series.get(0).length;
        for (double[] s : series) {
            if (s.length != length) {
                throw new IllegalArgumentException(kind.id() + " series must have equal length");
            }
        }
        double[] p = resolveParams(kind, params);

        return switch (kind) {
            case SMA -> new IndicatorResult(kind, SMA.calculate(series.get(0), (int) p[0]));
            case EMA -> new IndicatorResult(kind, EMA.calculate(series.get(0), (int) p[0]));
            case RSI -> new IndicatorResult(kind, RSI.calculate(series.get(0), (int) p[0]));
            case PREV -> new IndicatorResult(kind, Prev.calculate(series.get(0), (int) p[0]));
            case ATR -> new IndicatorResult(kind,
                ATR.calculate(series.get(0), series.get(1), series.get(2), (int) p[0]));
            case BOLLINGER -> {
                BollingerBands.Result r = BollingerBands.calculate(series.get(0), (int) p[0], p[1]);
                yield new IndicatorResult(kind, r.middle(), r.upper(), r.lower());
            }
            case MACD -> {
                MACD.Result r = MACD.calculate(series.get(0), (int) p[0], (int) p[1], (int) p[2]);
                yield new IndicatorResult(kind, r.line(), r.signal(), r.histogram());
            }
            case STOCHASTIC -> {
                Stochastic.Result r = Stochastic.calculate(
                    series.get(0), series.get(1), series.get(2), (int) p[0], (int) p[1]);
                yield new IndicatorResult(kind, r.k(), r.d());
            }
        };
    }

    private static double[] resolveParams(IndicatorKind kind, List<Double> given) {
        List<IndicatorKind.Param> declared = kind.params();
        if (given.size() > declared.size()) {
            throw new IllegalArgumentException(kind.id() + " takes at most " + declared.size()
                + " parameters, got " + given.size());
        }
        List<Double> values = new ArrayList<>(given);
        for (int i = given.size(); i < declared.size(); i++) {
            IndicatorKind.Param param = declared.get(i);
            if (param.required()) {
                throw new IllegalArgumentException(kind.id() + " requires parameter '" + param.name() + "'");
            }
            values.add(param.defaultValue());
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
