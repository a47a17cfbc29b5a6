package com.tradelang.core.indicators;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named output series of one indicator computation, in the order the kind declares them.
 */
public final class IndicatorResult {

    private final IndicatorKind kind;
    private final Map<String, double[]> outputs;

    IndicatorResult(IndicatorKind kind, double[]... series) {
        List<String> names = kind.outputs();
        if (names.size() != series.length) {
            throw new IllegalArgumentException(kind.id() + " declares " + names.size()
                + " outputs, got " + series.length);
        }
        this.kind = kind;
        this.outputs = new LinkedHashMap<>();
        for (int i = 0; i < series.length; i++) {
            outputs.put(names.get(i), series[i]);
        }
    }

    public IndicatorKind kind() {
        return kind;
    }

    /**
     * @throws IllegalArgumentException if the kind has no such output
     */
    public double[] output(String name) {
        double[] values = outputs.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Indicator " + kind.id() + " has no output '" + name
                + "'. Valid outputs: " + kind.outputs());
        }
        return values;
    }

    public double[] primary() {
        return outputs.get(kind.defaultOutput());
    }
}
