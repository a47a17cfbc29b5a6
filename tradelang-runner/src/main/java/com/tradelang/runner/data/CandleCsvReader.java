package com.tradelang.runner.data;

import com.tradelang.core.model.Candle;
import com.tradelang.core.model.PriceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads OHLCV bars from CSV into a {@link PriceTable}.
 *
 * The first non-empty line is the header. It needs a {@code date} or
 * {@code timestamp} column plus open, high, low, close and volume, in any order
 * and any case. Times are epoch milliseconds or ISO-8601 dates/date-times (UTC
 * unless an offset is given). Unparseable rows are skipped with a warning;
 * rows are sorted by time and duplicate times keep the first row.
 */
public class CandleCsvReader {

    private static final Logger log = LoggerFactory.getLogger(CandleCsvReader.class);

    private static final List<String> TIME_COLUMNS = List.of("timestamp", "date", "time", "datetime");
    private static final List<String> PRICE_COLUMNS = List.of("open", "high", "low", "close", "volume");

    public PriceTable read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            PriceTable table = read(reader);
            log.info("Loaded {} bars from {}", table.size(), file);
            return table;
        }
    }

    public PriceTable read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);

        String header = nextNonEmpty(reader);
        if (header == null) {
            throw new IOException("CSV is empty: expected a header with date,open,high,low,close,volume");
        }
        Map<String, Integer> columns = headerIndex(header);

        int timeColumn = -1;
        for (String name : TIME_COLUMNS) {
            if (columns.containsKey(name)) {
                timeColumn = columns.get(name);
                break;
            }
        }
        if (timeColumn < 0) {
            throw new IOException("CSV header has no date or timestamp column: " + header);
        }
        int[] priceColumns = new int[PRICE_COLUMNS.size()];
        for (int i = 0; i < PRICE_COLUMNS.size(); i++) {
            Integer index = columns.get(PRICE_COLUMNS.get(i));
            if (index == null) {
                throw new IOException("CSV header is missing column '" + PRICE_COLUMNS.get(i) + "': " + header);
            }
            priceColumns[i] = index;
        }

        List<Candle> candles = new ArrayList<>();
        int lineNumber = 1;
        int rows = 0;
        int skipped = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) continue;
            rows++;

            try {
                candles.add(parseRow(line.split(",", -1), timeColumn, priceColumns));
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Skipping CSV line {} ({}): {}", lineNumber, e.getMessage(), line);
            }
        }

        candles.sort(Comparator.comparingLong(Candle::timestamp));
        List<Candle> unique = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            if (!unique.isEmpty() && unique.get(unique.size() - 1).timestamp() == c.timestamp()) {
                skipped++;
                log.warn("Skipping duplicate bar at {}", Instant.ofEpochMilli(c.timestamp()));
                continue;
            }
            unique.add(c);
        }

        if (skipped > 0) {
            log.warn("Skipped {} of {} CSV rows", skipped, rows);
        }
        if (unique.isEmpty()) {
            throw new IOException("CSV has no valid rows");
        }
        return PriceTable.of(unique);
    }

    private static Candle parseRow(String[] cells, int timeColumn, int[] priceColumns) {
        double[] values = new double[priceColumns.length];
        for (int i = 0; i < priceColumns.length; i++) {
            String cell = cell(cells, priceColumns[i]);
            double value = Double.parseDouble(cell);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(PRICE_COLUMNS.get(i) + " is not finite");
            }
            values[i] = value;
        }
        return new Candle(parseTime(cell(cells, timeColumn)), values[0], values[1], values[2], values[3], values[4]);
    }

    private static String cell(String[] cells, int index) {
        if (index >= cells.length) {
            throw new IllegalArgumentException("expected at least " + (index + 1) + " columns, got " + cells.length);
        }
        return unquote(cells[index].trim());
    }

    /**
     * Parse epoch milliseconds or an ISO-8601 date, local date-time or offset date-time.
     */
    static long parseTime(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(value);
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            String normalized = value.replace(' ', 'T');
            if (normalized.endsWith("Z") || normalized.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(normalized).toInstant().toEpochMilli();
            }
            return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unrecognized time '" + value + "'", e);
        }
    }

    private static Map<String, Integer> headerIndex(String header) {
        Map<String, Integer> columns = new HashMap<>();
        String[] names = header.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(unquote(names[i].trim()).toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    private static String nextNonEmpty(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                // Spreadsheet exports often start with a byte order mark
                return line.replace("\uFEFF", "").trim();
            }
        }
        return null;
    }
}
