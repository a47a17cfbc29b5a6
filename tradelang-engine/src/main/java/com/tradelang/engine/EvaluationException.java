package com.tradelang.engine;

import com.tradelang.core.dsl.StrategyException;

/**
 * Unexpected failure while computing signals. Names the indicator involved, when there is one.
 */
public class EvaluationException extends StrategyException {

    private final String indicator;

    public EvaluationException(String message) {
        super(message);
        this.indicator = null;
    }

    public EvaluationException(String indicator, String message, Throwable cause) {
        super("Failed to evaluate " + indicator + ": " + message, cause);
        this.indicator = indicator;
    }

    /**
     * Canonical key of the failing indicator, null when the failure is not tied to one.
     */
    public String getIndicator() {
        return indicator;
    }
}
