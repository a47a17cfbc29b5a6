package com.tradelang.core.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Comparison and crossing operators.
 */
public enum ComparisonOp {
    GREATER(">"),
    LESS("<"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<="),
    EQUAL("=="),
    CROSSES_ABOVE("CROSSES_ABOVE"),
    CROSSES_BELOW("CROSSES_BELOW");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Crossing operators look at the previous bar as well as the current one.
     */
    public boolean crossing() {
        return this == CROSSES_ABOVE || this == CROSSES_BELOW;
    }

    /**
     * Point-wise test for the non-crossing operators. NaN on either side is false.
     */
    public boolean test(double left, double right) {
        return switch (this) {
            case GREATER -> left > right;
            case LESS -> left < right;
            case GREATER_EQUAL -> left >= right;
            case LESS_EQUAL -> left <= right;
            case EQUAL -> left == right;
            case CROSSES_ABOVE, CROSSES_BELOW ->
                throw new IllegalStateException(symbol + " needs the previous bar");
        };
    }

    @JsonCreator
    public static ComparisonOp fromSymbol(String symbol) {
        for (ComparisonOp op : values()) {
            if (op.symbol.equalsIgnoreCase(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }

    public static List<String> symbols() {
        return Arrays.stream(values()).map(ComparisonOp::symbol).toList();
    }
}
