package com.tradelang.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Configuration for a backtest run
 *
 * @param initialCapital       starting equity, fully invested on every entry
 * @param annualizationPeriods periods per year used to scale the Sharpe-like ratio
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(double initialCapital, int annualizationPeriods) {

    public static final double DEFAULT_CAPITAL = 10_000.0;
    public static final int DEFAULT_ANNUALIZATION = 252;

    public BacktestConfig {
        if (!(initialCapital > 0) || Double.isInfinite(initialCapital)) {
            throw new IllegalArgumentException("Initial capital must be positive, got " + initialCapital);
        }
        if (annualizationPeriods <= 0) {
            throw new IllegalArgumentException("Annualization periods must be positive, got " + annualizationPeriods);
        }
    }

    /**
     * Create default config
     */
    public static BacktestConfig defaults() {
        return new BacktestConfig(DEFAULT_CAPITAL, DEFAULT_ANNUALIZATION);
    }

    public static BacktestConfig withCapital(double initialCapital) {
        return new BacktestConfig(initialCapital, DEFAULT_ANNUALIZATION);
    }
}
