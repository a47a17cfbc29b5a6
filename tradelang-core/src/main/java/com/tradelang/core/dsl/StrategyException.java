package com.tradelang.core.dsl;

/**
 * Base type for every failure raised while compiling or evaluating a strategy.
 * All subtypes are fatal to the call that raised them.
 */
public abstract class StrategyException extends RuntimeException {

    protected StrategyException(String message) {
        super(message);
    }

    protected StrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
