package com.example.subtracker.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row read from a {@link LedgerStore}, keyed by column name.
 *
 * @param rowNumber 1-based position in the backing sheet; the header occupies row 1
 */
public record LedgerRow(int rowNumber, Map<String, String> values) {

    public LedgerRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String column) {
        return values.get(column);
    }
}
