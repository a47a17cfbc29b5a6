package com.tradelang.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Columns of a {@link PriceTable} that strategy text can reference by name.
 */
public enum PriceField {
    OPEN,
    HIGH,
    LOW,
    CLOSE,
    VOLUME;

    /**
     * Name as written in strategy text.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PriceField> fromId(String id) {
        for (PriceField field : values()) {
            if (field.id().equalsIgnoreCase(id)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(PriceField::id).toList();
    }
}
