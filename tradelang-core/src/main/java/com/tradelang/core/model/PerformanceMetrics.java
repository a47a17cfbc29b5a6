package com.tradelang.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Performance metrics calculated from backtest trades.
 *
 * Returns, averages and win rate are in percent; {@code maxDrawdown} is a
 * fraction (0 or negative) and {@code maxDrawdownPercent} the same value in percent.
 * Values are not rounded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerformanceMetrics(
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double totalReturn,
    double totalReturnPercent,
    double maxDrawdown,
    double maxDrawdownPercent,
    double averageReturn,
    double averageWin,
    double averageLoss,
    double profitFactor,
    double sharpeRatio,
    double finalEquity,
    double initialEquity
) {
    /**
     * Create empty metrics (no closed trades)
     */
    public static PerformanceMetrics empty(double initialCapital, double maxDrawdown) {
        return new PerformanceMetrics(
            0, 0, 0, 0, 0, 0, maxDrawdown, maxDrawdown * 100, 0, 0, 0, 0, 0, initialCapital, initialCapital
        );
    }

    /**
     * Calculate metrics from a list of closed trades
     *
     * @param finalEquity          last value of the equity curve
     * @param maxDrawdown          most negative drawdown fraction seen on the equity curve
     * @param annualizationPeriods periods per year for the Sharpe-like ratio
     */
    public static PerformanceMetrics calculate(List<Trade> trades, double initialCapital, double finalEquity,
                                               double maxDrawdown, int annualizationPeriods) {
        if (trades == null || trades.isEmpty()) {
            return empty(initialCapital, maxDrawdown);
        }

        int total = trades.size();
        int winners = 0;
        int losers = 0;
        double totalWins = 0;
        double totalLosses = 0;
        double sumReturns = 0;
        double sumWinReturns = 0;
        double sumLossReturns = 0;

        for (Trade t : trades) {
            double r = t.returnPercent();
            sumReturns += r;

            if (t.winner()) {
                winners++;
                totalWins += t.pnl();
                sumWinReturns += r;
            } else if (t.loser()) {
                losers++;
                totalLosses += Math.abs(t.pnl());
                sumLossReturns += r;
            }
        }

        double winRate = (double) winners / total * 100;
        double totalReturn = finalEquity - initialCapital;
        double totalReturnPercent = totalReturn / initialCapital * 100;
        double averageReturn = sumReturns / total;
        double averageWin = winners > 0 ? sumWinReturns / winners : 0;
        double averageLoss = losers > 0 ? sumLossReturns / losers : 0;

        double profitFactor;
        if (totalLosses > 0) {
            profitFactor = totalWins / totalLosses;
        } else {
            profitFactor = winners > 0 ? Double.POSITIVE_INFINITY : 0;
        }

        double sharpe = sharpeRatio(trades, averageReturn, annualizationPeriods);

        return new PerformanceMetrics(
            total, winners, losers, winRate,
            totalReturn, totalReturnPercent,
            maxDrawdown, maxDrawdown * 100,
            averageReturn, averageWin, averageLoss,
            profitFactor, sharpe,
            finalEquity, initialCapital
        );
    }

    /**
     * mean / population stdev of per-trade percent returns, scaled by sqrt(periods / N).
     * Zero for fewer than two trades or no dispersion.
     */
    private static double sharpeRatio(List<Trade> trades, double mean, int annualizationPeriods) {
        int n = trades.size();
        if (n < 2) {
            return 0;
        }

        double sumSq = 0;
        for (Trade t : trades) {
            double diff = t.returnPercent() - mean;
            sumSq += diff * diff;
        }
        double stdDev = Math.sqrt(sumSq / n);
        if (stdDev == 0) {
            return 0;
        }

        return mean / stdDev * Math.sqrt((double) annualizationPeriods / n);
    }
}
