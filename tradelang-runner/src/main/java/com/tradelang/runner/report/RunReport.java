package com.tradelang.runner.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradelang.core.model.BacktestResult;
import com.tradelang.core.model.PerformanceMetrics;
import com.tradelang.core.model.Position;
import com.tradelang.core.model.Trade;
import com.tradelang.runner.PipelineResult;
import com.tradelang.runner.translate.StrategyIr;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * JSON document written for one pipeline run. The equity curve is copied on the
 * way in and out and compared by content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
    String strategyName,
    Instant generatedAt,
    String naturalLanguage,
    StrategyIr ir,
    String dsl,
    List<String> indicators,
    int bars,
    int entrySignals,
    int exitSignals,
    double initialCapital,
    PerformanceMetrics metrics,
    List<Trade> trades,
    Position openPosition,
    double[] equityCurve
) {
    public RunReport {
        equityCurve = equityCurve.clone();
    }

    @Override
    public double[] equityCurve() {
        return equityCurve.clone();
    }

    public static RunReport from(String strategyName, PipelineResult result, Instant generatedAt) {
        BacktestResult backtest = result.backtest();
        return new RunReport(
            strategyName,
            generatedAt,
            result.naturalLanguage(),
            result.ir(),
            result.dsl(),
            result.indicatorKeys(),
            backtest.barsProcessed(),
            result.signals().entryCount(),
            result.signals().exitCount(),
            backtest.config().initialCapital(),
            backtest.metrics(),
            backtest.trades(),
            backtest.openPosition(),
            backtest.equityCurve()
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunReport other)) return false;
        return bars == other.bars
            && entrySignals == other.entrySignals
            && exitSignals == other.exitSignals
            && Double.compare(initialCapital, other.initialCapital) == 0
            && Objects.equals(strategyName, other.strategyName)
            && Objects.equals(generatedAt, other.generatedAt)
            && Objects.equals(naturalLanguage, other.naturalLanguage)
            && Objects.equals(ir, other.ir)
            && Objects.equals(dsl, other.dsl)
            && Objects.equals(indicators, other.indicators)
            && Objects.equals(metrics, other.metrics)
            && Objects.equals(trades, other.trades)
            && Objects.equals(openPosition, other.openPosition)
            && Arrays.equals(equityCurve, other.equityCurve);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(strategyName, generatedAt, naturalLanguage, ir, dsl, indicators, bars,
            entrySignals, exitSignals, initialCapital, metrics, trades, openPosition);
        return 31 * result + Arrays.hashCode(equityCurve);
    }
}
