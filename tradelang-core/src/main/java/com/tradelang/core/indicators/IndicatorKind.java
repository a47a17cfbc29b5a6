package com.tradelang.core.indicators;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed registry of indicators the language knows.
 *
 * Each kind takes a fixed number of series arguments followed by optional
 * numeric parameters. Omitted parameters take the listed defaults; a
 * {@code null} default marks a required parameter.
 */
public enum IndicatorKind {

    SMA("sma", 1, new Param[] {required("period")}, "value"),
    EMA("ema", 1, new Param[] {required("period")}, "value"),
    RSI("rsi", 1, new Param[] {optional("period", 14)}, "value"),
    PREV("prev", 1, new Param[] {optional("n", 1)}, "value"),
    ATR("atr", 3, new Param[] {optional("period", 14)}, "value"),
    BOLLINGER("bollinger", 1,
        new Param[] {optional("period", 20), optional("std_dev", 2)}, "middle", "upper", "lower"),
    MACD("macd", 1,
        new Param[] {optional("fast", 12), optional("slow", 26), optional("signal", 9)},
        "line", "signal", "histogram"),
    STOCHASTIC("stochastic", 3,
        new Param[] {optional("k", 14), optional("d", 3)}, "k", "d");

    /**
     * Numeric parameter of an indicator.
     *
     * @param name         parameter name, used in error messages
     * @param defaultValue value used when omitted, null when the parameter is required
     */
    public record Param(String name, Double defaultValue) {
        public boolean required() {
            return defaultValue == null;
        }
    }

    private final String id;
    private final int seriesCount;
    private final List<Param> params;
    private final List<String> outputs;

    IndicatorKind(String id, int seriesCount, Param[] params, String... outputs) {
        this.id = id;
        this.seriesCount = seriesCount;
        this.params = List.of(params);
        this.outputs = List.of(outputs);
    }

    public String id() {
        return id;
    }

    /**
     * Call shape shown in error messages, e.g. {@code rsi(series[, period])}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(id).append('(');
        sb.append(seriesCount == 3 ? "high, low, close" : "series");
        boolean bracketOpen = false;
        for (Param param : params) {
            if (!param.required() && !bracketOpen) {
                sb.append('[');
                bracketOpen = true;
            }
            sb.append(", ").append(param.name());
        }
        if (bracketOpen) {
            sb.append(']');
        }
        return sb.append(')').toString();
    }

    /**
     * Number of leading series arguments (price fields, expressions or other indicators).
     */
    public int seriesCount() {
        return seriesCount;
    }

    public List<Param> params() {
        return params;
    }

    public int minArgs() {
        return seriesCount + (int) params.stream().filter(Param::required).count();
    }

    public int maxArgs() {
        return seriesCount + params.size();
    }

    public List<String> outputs() {
        return outputs;
    }

    public String defaultOutput() {
        return outputs.get(0);
    }

    public static Optional<IndicatorKind> fromId(String id) {
        String normalized = id.toLowerCase(Locale.ROOT);
        for (IndicatorKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(IndicatorKind::id).toList();
    }

    private static Param required(String name) {
        return new Param(name, null);
    }

    private static Param optional(String name, double defaultValue) {
        return new Param(name, defaultValue);
    }
}
