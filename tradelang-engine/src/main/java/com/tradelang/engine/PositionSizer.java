package com.tradelang.engine;

/**
 * Handles position sizing for backtests. Every entry invests the full account equity.
 */
public class PositionSizer {

    /**
     * Number of shares (fractional) bought with {@code equity} at {@code price}.
     *
     * @throws IllegalArgumentException if the price is not a positive finite number
     */
    public double shares(double equity, double price) {
        if (!canEnterAt(price)) {
            throw new IllegalArgumentException("Cannot size a position at price " + price);
        }
        return equity / price;
    }

    public boolean canEnterAt(double price) {
        return price > 0 && !Double.isInfinite(price);
    }
}
