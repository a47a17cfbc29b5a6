package com.tradelang.engine;

import com.tradelang.core.dsl.Strategy;
import com.tradelang.core.model.PriceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles validated strategies into reusable signal procedures.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    /**
     * Build the indicator cache plan for a strategy. The result can be evaluated
     * against any number of price tables.
     */
    public CompiledStrategy compile(Strategy strategy) {
        IndicatorCache cache = IndicatorCache.collect(strategy);
        log.debug("Indicator cache plan: {} distinct calls {}", cache.size(), cache.keys());
        return new CompiledStrategy(strategy, cache);
    }

    /**
     * Compile and evaluate in one step.
     */
    public StrategySignals evaluate(Strategy strategy, PriceTable table) {
        return compile(strategy).evaluate(table);
    }
}
