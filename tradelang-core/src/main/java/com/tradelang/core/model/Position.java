package com.tradelang.core.model;

/**
 * Open long position. At most one exists at a time.
 *
 * @param equityAtEntry account equity when the position was opened, all of it invested
 */
public record Position(
    int entryBar,
    long entryTime,
    double entryPrice,
    double shareCount,
    double equityAtEntry
) {
    public double marketValue(double price) {
        return shareCount * price;
    }
}
