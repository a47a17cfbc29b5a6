package com.tradelang.runner;

import com.tradelang.core.dsl.Strategy;
import com.tradelang.core.dsl.StrategyCompiler;
import com.tradelang.core.model.BacktestConfig;
import com.tradelang.core.model.BacktestResult;
import com.tradelang.core.model.PriceTable;
import com.tradelang.engine.BacktestEngine;
import com.tradelang.engine.CompiledStrategy;
import com.tradelang.engine.ConditionEvaluator;
import com.tradelang.engine.StrategySignals;
import com.tradelang.runner.translate.JsonToDslConverter;
import com.tradelang.runner.translate.StrategyIr;
import com.tradelang.runner.translate.StrategyTranslator;
import com.tradelang.runner.translate.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Natural language to JSON to DSL to AST to signals to backtest, keeping every
 * intermediate form. A run may also start from JSON or from DSL text.
 *
 * Compile and evaluation failures propagate as {@code StrategyException}s.
 */
public class StrategyPipeline {

    private static final Logger log = LoggerFactory.getLogger(StrategyPipeline.class);

    private final StrategyTranslator translator;
    private final JsonToDslConverter converter;
    private final StrategyCompiler compiler;
    private final ConditionEvaluator evaluator;
    private final BacktestEngine engine;

    /**
     * Pipeline without a translator; only the JSON and DSL entry points are usable.
     */
    public StrategyPipeline() {
        this(null);
    }

    public StrategyPipeline(StrategyTranslator translator) {
        this(translator, new JsonToDslConverter(), new StrategyCompiler(), new ConditionEvaluator(), new BacktestEngine());
    }

    public StrategyPipeline(StrategyTranslator translator, JsonToDslConverter converter, StrategyCompiler compiler,
                            ConditionEvaluator evaluator, BacktestEngine engine) {
        this.translator = translator;
        this.converter = converter;
        this.compiler = compiler;
        this.evaluator = evaluator;
        this.engine = engine;
    }

    /**
     * Translate a trading rule and backtest it.
     *
     * @throws IllegalStateException if the pipeline has no translator
     */
    public PipelineResult run(String naturalLanguage, PriceTable table, double capital) throws TranslationException {
        if (translator == null) {
            throw new IllegalStateException("No translator configured for natural language input");
        }
        log.info("Translating: {}", naturalLanguage);
        StrategyIr ir = translator.translate(naturalLanguage);
        return execute(naturalLanguage, ir, converter.convert(ir), table, capital);
    }

    /**
     * Backtest a strategy given in the JSON form.
     */
    public PipelineResult runFromIr(StrategyIr ir, PriceTable table, double capital) {
        return execute(null, ir, converter.convert(ir), table, capital);
    }

    /**
     * Backtest strategy text.
     */
    public PipelineResult runFromDsl(String dsl, PriceTable table, double capital) {
        return execute(null, null, dsl, table, capital);
    }

    private PipelineResult execute(String naturalLanguage, StrategyIr ir, String dsl, PriceTable table, double capital) {
        BacktestConfig config = BacktestConfig.withCapital(capital);

        log.info("Compiling strategy:\n{}", dsl);
        Strategy strategy = compiler.compile(dsl);

        CompiledStrategy compiled = evaluator.compile(strategy);
        StrategySignals signals = compiled.evaluate(table);
        log.info("Signals over {} bars: {} entry, {} exit ({} indicators)",
            signals.size(), signals.entryCount(), signals.exitCount(), compiled.cache().size());

        BacktestResult backtest = engine.run(table, signals, config);

        return new PipelineResult(naturalLanguage, ir, dsl, strategy, compiled.cache().keys(), signals, backtest);
    }
}
