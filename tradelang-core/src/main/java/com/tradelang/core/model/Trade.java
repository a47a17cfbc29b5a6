package com.tradelang.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Closed round-trip trade.
 *
 * @param pnl        shareCount * (exitPrice - entryPrice)
 * @param pnlPercent fractional return, exitPrice / entryPrice - 1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    int entryBar,
    long entryTime,
    int exitBar,
    long exitTime,
    double entryPrice,
    double exitPrice,
    double shareCount,
    double pnl,
    double pnlPercent
) {
    /**
     * Close a position at the given bar and price.
     */
    public static Trade close(Position position, int exitBar, long exitTime, double exitPrice) {
        double pnl = position.shareCount() * (exitPrice - position.entryPrice());
        double pnlPercent = (exitPrice - position.entryPrice()) / position.entryPrice();
        return new Trade(
            position.entryBar(),
            position.entryTime(),
            exitBar,
            exitTime,
            position.entryPrice(),
            exitPrice,
            position.shareCount(),
            pnl,
            pnlPercent
        );
    }

    /**
     * Return in percent (pnlPercent * 100).
     */
    public double returnPercent() {
        return pnlPercent * 100;
    }

    public boolean winner() {
        return pnl > 0;
    }

    public boolean loser() {
        return pnl < 0;
    }
}
