package com.tradelang.runner;

import com.tradelang.core.dsl.Strategy;
import com.tradelang.core.model.BacktestResult;
import com.tradelang.engine.StrategySignals;
import com.tradelang.runner.translate.StrategyIr;

import java.util.List;

/**
 * Every representation a strategy passed through on its way to a backtest.
 *
 * @param naturalLanguage the translated text, null when the run started from JSON or DSL
 * @param ir              the JSON strategy form, null when the run started from DSL
 * @param indicatorKeys   canonical keys of the distinct indicator calls, sorted
 */
public record PipelineResult(
    String naturalLanguage,
    StrategyIr ir,
    String dsl,
    Strategy strategy,
    List<String> indicatorKeys,
    StrategySignals signals,
    BacktestResult backtest
) {
    public PipelineResult {
        indicatorKeys = List.copyOf(indicatorKeys);
    }
}
