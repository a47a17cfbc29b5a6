package com.tradelang.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bars of one instrument indexed by position, with each price field exposed as
 * an aligned column. Timestamps are unique and strictly increasing.
 */
public final class PriceTable {

    private final List<Candle> candles;
    private final long[] timestamps;
    private final Map<PriceField, double[]> columns = new EnumMap<>(PriceField.class);

    private PriceTable(List<Candle> candles) {
        this.candles = Collections.unmodifiableList(new ArrayList<>(candles));
        int n = candles.size();
        this.timestamps = new long[n];

        for (PriceField field : PriceField.values()) {
            columns.put(field, new double[n]);
        }

        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            if (i > 0 && c.timestamp() <= timestamps[i - 1]) {
                throw new IllegalArgumentException("Timestamps must be strictly increasing: bar " + i
                    + " at " + c.timestamp() + " follows " + timestamps[i - 1]);
            }
            timestamps[i] = c.timestamp();
            for (PriceField field : PriceField.values()) {
                columns.get(field)[i] = c.value(field);
            }
        }
    }

    /**
     * @throws IllegalArgumentException if timestamps are not unique and strictly increasing
     */
    public static PriceTable of(List<Candle> candles) {
        return new PriceTable(candles);
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public List<Candle> candles() {
        return candles;
    }

    public Candle candle(int index) {
        return candles.get(index);
    }

    public long timestamp(int index) {
        return timestamps[index];
    }

    /**
     * Copy of one field as a column aligned with the bars.
     */
    public double[] column(PriceField field) {
        return columns.get(field).clone();
    }

    public double close(int index) {
        return columns.get(PriceField.CLOSE)[index];
    }
}
