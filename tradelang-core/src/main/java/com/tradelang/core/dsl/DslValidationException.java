package com.tradelang.core.dsl;

import java.util.Collection;
import java.util.List;

/**
 * Grammatically valid text that names something the language does not know,
 * or uses a term where its type does not fit.
 */
public class DslValidationException extends StrategyException {

    private final String value;
    private final List<String> validValues;

    public DslValidationException(String message, String value, Collection<String> validValues) {
        super(validValues.isEmpty() ? message : message + ". Valid values: " + sorted(validValues));
        this.value = value;
        this.validValues = sorted(validValues);
    }

    /**
     * The offending name, operator or expression.
     */
    public String getValue() {
        return value;
    }

    /**
     * Sorted alternatives that would have been accepted, empty when not applicable.
     */
    public List<String> getValidValues() {
        return validValues;
    }

    private static List<String> sorted(Collection<String> values) {
        return values.stream().sorted().toList();
    }
}
