package com.tradelang.engine;

import java.util.Arrays;
import java.util.List;

/**
 * Entry and exit signals aligned with the bars of a price table. The arrays are
 * copied on the way in and out and compared by content.
 *
 * @param materializedIndicators canonical keys in the order they were computed
 */
public record StrategySignals(boolean[] entry, boolean[] exit, List<String> materializedIndicators) {

    public StrategySignals {
        if (entry.length != exit.length) {
            throw new IllegalArgumentException("Entry and exit signals differ in length: "
                + entry.length + " vs " + exit.length);
        }
        entry = entry.clone();
        exit = exit.clone();
        materializedIndicators = List.copyOf(materializedIndicators);
    }

    @Override
    public boolean[] entry() {
        return entry.clone();
    }

    @Override
    public boolean[] exit() {
        return exit.clone();
    }

    public int size() {
        return entry.length;
    }

    public int entryCount() {
        return count(entry);
    }

    public int exitCount() {
        return count(exit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StrategySignals other)) return false;
        return Arrays.equals(entry, other.entry)
            && Arrays.equals(exit, other.exit)
            && materializedIndicators.equals(other.materializedIndicators);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(entry);
        result = 31 * result + Arrays.hashCode(exit);
        return 31 * result + materializedIndicators.hashCode();
    }

    private static int count(boolean[] signals) {
        int n = 0;
        for (boolean s : signals) {
            if (s) {
                n++;
            }
        }
        return n;
    }
}
