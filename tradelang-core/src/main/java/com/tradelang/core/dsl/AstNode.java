package com.tradelang.core.dsl;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * AST Node types for a validated strategy expression.
 * Uses sealed interfaces for type safety; consumers walk the tree through {@link AstVisitor}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AstNode.NumberLiteral.class, name = "number"),
    @JsonSubTypes.Type(value = AstNode.BooleanLiteral.class, name = "boolean"),
    @JsonSubTypes.Type(value = AstNode.Field.class, name = "field"),
    @JsonSubTypes.Type(value = AstNode.Indicator.class, name = "indicator"),
    @JsonSubTypes.Type(value = AstNode.Arithmetic.class, name = "arithmetic"),
    @JsonSubTypes.Type(value = AstNode.Comparison.class, name = "comparison"),
    @JsonSubTypes.Type(value = AstNode.BoolCombinator.class, name = "combinator")
})
public sealed interface AstNode {

    <R> R accept(AstVisitor<R> visitor);

    /**
     * Numeric literal. Whole values are held as {@link Long}, the rest as {@link Double}.
     */
    record NumberLiteral(Number value) implements AstNode {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
            // Deserialized JSON may carry Integer, BigDecimal and friends
            if (!(value instanceof Long) && !(value instanceof Double)) {
                double d = value.doubleValue();
                value = d == Math.rint(d) && Math.abs(d) <= Long.MAX_VALUE ? (Number) (long) d : (Number) d;
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * Literal TRUE / FALSE.
     */
    record BooleanLiteral(boolean value) implements AstNode {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /**
     * Price field reference: open, high, low, close, volume
     */
    record Field(String name) implements AstNode {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitField(this);
        }
    }

    /**
     * Indicator call: sma(close, 20), macd(close, 12, 26, 9).signal
     *
     * @param name   registry id, lower case
     * @param args   series arguments followed by numeric parameters
     * @param output selected output, resolved to the indicator's default when the text names none
     */
    record Indicator(String name, List<AstNode> args, String output) implements AstNode {
        public Indicator {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIndicator(this);
        }
    }

    /**
     * Arithmetic expression: left * right, left / right, etc.
     */
    record Arithmetic(ArithmeticOp op, AstNode left, AstNode right) implements AstNode {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitArithmetic(this);
        }
    }

    /**
     * Comparison: left &gt; right, left CROSSES_ABOVE right, etc.
     */
    record Comparison(ComparisonOp op, AstNode left, AstNode right) implements AstNode {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * N-ary AND / OR over boolean children. Always has at least two children.
     */
    record BoolCombinator(Kind kind, List<AstNode> children) implements AstNode {
        public BoolCombinator {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitCombinator(this);
        }

        public enum Kind { AND, OR }
    }
}
