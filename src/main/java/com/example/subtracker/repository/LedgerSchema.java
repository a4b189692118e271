package com.example.subtracker.repository;

import java.util.HashSet;
import java.util.List;

/**
 * Ordered column layout of a tabular store. The first column is the key used by upserts.
 */
public record LedgerSchema(String name, List<String> columns) {

    public static final LedgerSchema REFERENCE = new LedgerSchema("reference",
            List.of("user_id", "sheet_id"));

    public static final LedgerSchema GIFTERS = new LedgerSchema("gifters",
            List.of("user_id", "user_name", "gifted_subs", "rewards_given"));

    public LedgerSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schema name cannot be blank");
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Schema must declare at least one column");
        }
        if (new HashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Schema columns must be unique: " + columns);
        }
        columns = List.copyOf(columns);
    }

    public String keyColumn() {
        return columns.get(0);
    }

    /**
     * @return the 0-based position of the column, or -1 when the schema does not declare it
     */
    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public int size() {
        return columns.size();
    }
}
