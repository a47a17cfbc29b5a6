package com.tradelang.runner.translate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the JSON strategy form as DSL text.
 *
 * Indicator names are written in upper case and bare field names in lower case.
 * An empty entry list renders {@code TRUE}, an empty exit list {@code FALSE}.
 */
public class JsonToDslConverter {

    private static final Pattern CALL_NAME = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    private static final Map<String, String> OPERATORS = Map.of(
        ">", ">",
        "<", "<",
        ">=", ">=",
        "<=", "<=",
        "==", "==",
        "crosses_above", "CROSSES_ABOVE",
        "crosses_below", "CROSSES_BELOW"
    );

    public String convert(StrategyIr strategy) {
        String entry = strategy.entry().isEmpty() ? "TRUE" : buildExpression(strategy.entry());
        String exit = strategy.exit().isEmpty() ? "FALSE" : buildExpression(strategy.exit());

        return "ENTRY:\n  " + entry + "\n\nEXIT:\n  " + exit;
    }

    /**
     * Join conditions left to right with their connectors. The connector of the
     * last condition is ignored.
     */
    String buildExpression(List<ConditionIr> conditions) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < conditions.size(); i++) {
            ConditionIr cond = conditions.get(i);
            if (cond.left() == null || cond.operator() == null || cond.right() == null) {
                throw new IllegalArgumentException("Condition " + (i + 1) + " needs left, operator and right: " + cond);
            }

            sb.append(formatTerm(cond.left()))
                .append(' ').append(formatOperator(cond.operator()))
                .append(' ').append(formatTerm(cond.right()));

            if (i < conditions.size() - 1) {
                String connector = cond.connector() != null && !cond.connector().isBlank()
                    ? cond.connector().trim().toUpperCase(Locale.ROOT)
                    : "AND";
                sb.append(' ').append(connector).append(' ');
            }
        }
        return sb.toString();
    }

    String formatTerm(Object term) {
        if (term instanceof Number number) {
            return formatNumber(number);
        }

        String text = term.toString().trim();

        if (text.indexOf('(') >= 0) {
            // Upper-case every call name: "sma(close, 20) * 1.1" -> "SMA(close, 20) * 1.1"
            Matcher m = CALL_NAME.matcher(text);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1).toUpperCase(Locale.ROOT) + "("));
            }
            m.appendTail(sb);
            return sb.toString();
        }

        if (text.contains("+") || text.contains("-") || text.contains("*") || text.contains("/")) {
            return text;
        }

        return text.toLowerCase(Locale.ROOT);
    }

    String formatOperator(String operator) {
        String key = operator.trim().toLowerCase(Locale.ROOT);
        String mapped = OPERATORS.get(key);
        return mapped != null ? mapped : operator.trim().toUpperCase(Locale.ROOT);
    }

    private static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Condition value must be finite, got " + value);
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }
}
