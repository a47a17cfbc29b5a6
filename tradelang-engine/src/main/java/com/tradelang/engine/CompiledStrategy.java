package com.tradelang.engine;

import com.tradelang.core.dsl.AstNode;
import com.tradelang.core.dsl.AstVisitor;
import com.tradelang.core.dsl.ComparisonOp;
import com.tradelang.core.dsl.Strategy;
import com.tradelang.core.indicators.IndicatorKind;
import com.tradelang.core.indicators.IndicatorResult;
import com.tradelang.core.indicators.Indicators;
import com.tradelang.core.model.PriceField;
import com.tradelang.core.model.PriceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A strategy with its indicator cache plan, ready to produce signals for a price table.
 *
 * Holds no per-run state: every {@link #evaluate} call materializes indicators
 * into fresh storage, so repeated calls on the same table give identical results.
 */
public final class CompiledStrategy {

    private static final Logger log = LoggerFactory.getLogger(CompiledStrategy.class);

    private final Strategy strategy;
    private final IndicatorCache cache;

    CompiledStrategy(Strategy strategy, IndicatorCache cache) {
        this.strategy = strategy;
        this.cache = cache;
    }

    public Strategy strategy() {
        return strategy;
    }

    public IndicatorCache cache() {
        return cache;
    }

    /**
     * Compute entry and exit signals. Bars where a value is undefined resolve to false.
     *
     * @throws EvaluationException if an indicator cannot be computed
     */
    public StrategySignals evaluate(PriceTable table) {
        Run run = new Run(table);

        // Sorted key order, nested dependencies pulled in on demand
        for (String key : cache.keys()) {
            run.resolve(key);
        }

        boolean[] entry = run.condition(strategy.entry());
        boolean[] exit = run.condition(strategy.exit());

        return new StrategySignals(entry, exit, run.materialized);
    }

    /**
     * Per-evaluation state: price columns and materialized indicators.
     */
    private final class Run {

        private final PriceTable table;
        private final int size;
        private final Map<PriceField, double[]> columns = new EnumMap<>(PriceField.class);
        private final Map<String, IndicatorResult> results = new HashMap<>();
        private final List<String> materialized = new ArrayList<>();
        private final NumericVisitor numeric = new NumericVisitor();
        private final ConditionVisitor conditions = new ConditionVisitor();

        Run(PriceTable table) {
            this.table = table;
            this.size = table.size();
        }

        boolean[] condition(AstNode node) {
            return node.accept(conditions);
        }

        double[] series(AstNode node) {
            return node.accept(numeric);
        }

        double[] column(PriceField field) {
            return columns.computeIfAbsent(field, table::column);
        }

        IndicatorResult resolve(String key) {
            IndicatorResult result = results.get(key);
            if (result != null) {
                return result;
            }

            AstNode.Indicator node = cache.get(key);
            if (node == null) {
                throw new EvaluationException(key, "not part of the indicator cache plan", null);
            }

            IndicatorKind kind = IndicatorKind.fromId(node.name())
                .orElseThrow(() -> new EvaluationException(key, "unknown indicator '" + node.name() + "'",
                    null));

            try {
                List<double[]> inputs = new ArrayList<>();
                List<Double> params = new ArrayList<>();
                for (int i = 0; i < node.args().size(); i++) {
                    AstNode arg = node.args().get(i);
                    if (i < kind.seriesCount()) {
                        inputs.add(series(arg));
                    } else if (arg instanceof AstNode.NumberLiteral literal) {
                        params.add(literal.value().doubleValue());
                    } else {
                        throw new IllegalArgumentException("parameter " + (i + 1) + " is not a number literal");
                    }
                }
                result = Indicators.compute(kind, inputs, params);
            } catch (EvaluationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EvaluationException(key, e.getMessage(), e);
            }

            results.put(key, result);
            materialized.add(key);
            log.debug("Materialized indicator {} over {} bars", key, size);
            return result;
        }

        private double[] filled(double value) {
            double[] values = new double[size];
            Arrays.fill(values, value);
            return values;
        }

        private final class NumericVisitor implements AstVisitor<double[]> {

            @Override
            public double[] visitNumber(AstNode.NumberLiteral node) {
                return filled(node.value().doubleValue());
            }

            @Override
            public double[] visitBoolean(AstNode.BooleanLiteral node) {
                throw new EvaluationException("Boolean literal used where a number is expected");
            }

            @Override
            public double[] visitField(AstNode.Field node) {
                PriceField field = PriceField.fromId(node.name())
                    .orElseThrow(() -> new EvaluationException("Price table has no column '" + node.name() + "'"));
                return column(field);
            }

            @Override
            public double[] visitIndicator(AstNode.Indicator node) {
                String key = IndicatorCache.canonicalKey(node);
                IndicatorResult result = resolve(key);
                try {
                    return result.output(node.output());
                } catch (IllegalArgumentException e) {
                    throw new EvaluationException(key, e.getMessage(), e);
                }
            }

            @Override
            public double[] visitArithmetic(AstNode.Arithmetic node) {
                double[] left = node.left().accept(this);
                double[] right = node.right().accept(this);
                double[] out = new double[size];
                for (int i = 0; i < size; i++) {
                    out[i] = node.op().apply(left[i], right[i]);
                }
                return out;
            }

            @Override
            public double[] visitComparison(AstNode.Comparison node) {
                throw new EvaluationException("Condition used where a number is expected");
            }

            @Override
            public double[] visitCombinator(AstNode.BoolCombinator node) {
                throw new EvaluationException(node.kind() + " used where a number is expected");
            }
        }

        private final class ConditionVisitor implements AstVisitor<boolean[]> {

            @Override
            public boolean[] visitNumber(AstNode.NumberLiteral node) {
                throw new EvaluationException("Number used where a condition is expected");
            }

            @Override
            public boolean[] visitBoolean(AstNode.BooleanLiteral node) {
                boolean[] out = new boolean[size];
                Arrays.fill(out, node.value());
                return out;
            }

            @Override
            public boolean[] visitField(AstNode.Field node) {
                throw new EvaluationException("Field '" + node.name() + "' used where a condition is expected");
            }

            @Override
            public boolean[] visitIndicator(AstNode.Indicator node) {
                throw new EvaluationException("Indicator '" + node.name() + "' used where a condition is expected");
            }

            @Override
            public boolean[] visitArithmetic(AstNode.Arithmetic node) {
                throw new EvaluationException("Arithmetic used where a condition is expected");
            }

            @Override
            public boolean[] visitComparison(AstNode.Comparison node) {
                double[] left = series(node.left());
                double[] right = series(node.right());
                ComparisonOp op = node.op();
                boolean[] out = new boolean[size];

                if (op == ComparisonOp.CROSSES_ABOVE) {
                    for (int i = 1; i < size; i++) {
                        out[i] = left[i] > right[i] && left[i - 1] <= right[i - 1];
                    }
                } else if (op == ComparisonOp.CROSSES_BELOW) {
                    for (int i = 1; i < size; i++) {
                        out[i] = left[i] < right[i] && left[i - 1] >= right[i - 1];
                    }
                } else {
                    // NaN compares false under every operator
                    for (int i = 0; i < size; i++) {
                        out[i] = op.test(left[i], right[i]);
                    }
                }
                return out;
            }

            @Override
            public boolean[] visitCombinator(AstNode.BoolCombinator node) {
                boolean and = node.kind() == AstNode.BoolCombinator.Kind.AND;
                boolean[] out = new boolean[size];
                Arrays.fill(out, and);

                for (AstNode child : node.children()) {
                    boolean[] values = child.accept(this);
                    for (int i = 0; i < size; i++) {
                        out[i] = and ? out[i] && values[i] : out[i] || values[i];
                    }
                }
                return out;
            }
        }
    }
}
