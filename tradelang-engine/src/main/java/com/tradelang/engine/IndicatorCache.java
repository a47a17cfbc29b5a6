package com.tradelang.engine;

import com.tradelang.core.dsl.AstNode;
import com.tradelang.core.dsl.AstVisitor;
import com.tradelang.core.dsl.Strategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Every distinct indicator call in a strategy, keyed by canonical signature.
 *
 * Keys are {@code name_arg1_arg2...}: literals as written ({@code 20}, {@code 2.5}),
 * fields by name, nested indicators by their own key and arithmetic as
 * {@code (left op right)}. The output selector is not part of the key, so
 * {@code macd(close).line} and {@code macd(close).signal} share one entry.
 * Iteration is in key order.
 */
public final class IndicatorCache {

    private final Map<String, AstNode.Indicator> entries;

    private IndicatorCache(Map<String, AstNode.Indicator> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Walk both condition trees, including indicator arguments, and collect every indicator call.
     */
    public static IndicatorCache collect(Strategy strategy) {
        Map<String, AstNode.Indicator> entries = new TreeMap<>();
        Collector collector = new Collector(entries);
        strategy.entry().accept(collector);
        strategy.exit().accept(collector);
        return new IndicatorCache(entries);
    }

    public int size() {
        return entries.size();
    }

    public AstNode.Indicator get(String key) {
        return entries.get(key);
    }

    /**
     * Canonical keys in sorted order.
     */
    public List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Canonical signature of any numeric expression.
     */
    public static String canonicalKey(AstNode node) {
        return node.accept(KEYS);
    }

    private static final AstVisitor<String> KEYS = new AstVisitor<>() {
        @Override
        public String visitNumber(AstNode.NumberLiteral node) {
            Number value = node.value();
            if (value instanceof Double || value instanceof Float) {
                double d = value.doubleValue();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return String.valueOf((long) d);
                }
                return String.valueOf(d);
            }
            return String.valueOf(value.longValue());
        }

        @Override
        public String visitBoolean(AstNode.BooleanLiteral node) {
            return String.valueOf(node.value());
        }

        @Override
        public String visitField(AstNode.Field node) {
            return node.name();
        }

        @Override
        public String visitIndicator(AstNode.Indicator node) {
            StringBuilder key = new StringBuilder(node.name());
            for (AstNode arg : node.args()) {
                key.append('_').append(arg.accept(this));
            }
            return key.toString();
        }

        @Override
        public String visitArithmetic(AstNode.Arithmetic node) {
            return "(" + node.left().accept(this) + node.op().symbol() + node.right().accept(this) + ")";
        }

        @Override
        public String visitComparison(AstNode.Comparison node) {
            return "(" + node.left().accept(this) + " " + node.op().symbol() + " " + node.right().accept(this) + ")";
        }

        @Override
        public String visitCombinator(AstNode.BoolCombinator node) {
            List<String> parts = new ArrayList<>();
            for (AstNode child : node.children()) {
                parts.add(child.accept(this));
            }
            return "(" + String.join(" " + node.kind() + " ", parts) + ")";
        }
    };

    /**
     * Collection pass. Records each indicator once and descends into its arguments.
     */
    private static final class Collector implements AstVisitor<Void> {

        private final Map<String, AstNode.Indicator> entries;

        Collector(Map<String, AstNode.Indicator> entries) {
            this.entries = entries;
        }

        @Override
        public Void visitNumber(AstNode.NumberLiteral node) {
            return null;
        }

        @Override
        public Void visitBoolean(AstNode.BooleanLiteral node) {
            return null;
        }

        @Override
        public Void visitField(AstNode.Field node) {
            return null;
        }

        @Override
        public Void visitIndicator(AstNode.Indicator node) {
            entries.putIfAbsent(canonicalKey(node), node);
            for (AstNode arg : node.args()) {
                arg.accept(this);
            }
            return null;
        }

        @Override
        public Void visitArithmetic(AstNode.Arithmetic node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitComparison(AstNode.Comparison node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitCombinator(AstNode.BoolCombinator node) {
            for (AstNode child : node.children()) {
                child.accept(this);
            }
            return null;
        }
    }
}
