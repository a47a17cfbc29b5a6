package com.tradelang.core.model;

/**
 * OHLCV bar. Timestamp is epoch milliseconds at the bar open.
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Value of one price column for this bar.
     */
    public double value(PriceField field) {
        return switch (field) {
            case OPEN -> open;
            case HIGH -> high;
            case LOW -> low;
            case CLOSE -> close;
            case VOLUME -> volume;
        };
    }
}
