package com.example.subtracker.repository;

import com.example.subtracker.exception.SchemaException;
import com.example.subtracker.util.Constants;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Row-level view of a {@link TabularStore} constrained by a {@link LedgerSchema}.
 * <p>
 * The header row is checked against the schema on construction; a mismatch is a
 * {@link SchemaException} and the store is never used. A store holding only its header
 * is a valid, empty ledger.
 */
@Slf4j
public class LedgerStore {

    private static final int HEADER_ROW = 1;

    private final TabularStore backend;
    private final LedgerSchema schema;

    public LedgerStore(TabularStore backend, LedgerSchema schema) {
        this.backend = backend;
        this.schema = schema;
        validateSchema();
    }

    public String storeId() {
        return backend.id();
    }

    public LedgerSchema schema() {
        return schema;
    }

    public List<LedgerRow> getAllRows() {
        List<List<String>> grid = backend.readAll();
        List<LedgerRow> rows = new ArrayList<>();
        for (int i = HEADER_ROW; i < grid.size(); i++) {
            List<String> cells = grid.get(i);
            if (isBlank(cells)) {
                continue;
            }
            rows.add(toRow(i + 1, cells));
        }
        return rows;
    }

    public Optional<LedgerRow> findRow(String keyColumn, String value) {
        requireColumn(keyColumn);
        return getAllRows().stream()
                .filter(row -> value != null && value.equals(row.get(keyColumn)))
                .findFirst();
    }

    /**
     * Overwrites the row whose key column matches {@code values}, or appends one after the
     * last data row.
     *
     * @param values a value for every schema column and no others
     * @return the row as written
     */
    public LedgerRow upsert(Map<String, String> values) {
        if (values == null || !values.keySet().equals(Set.copyOf(schema.columns()))) {
            throw new SchemaException(String.format("%s: expected columns %s but got %s",
                    Constants.ErrorMessages.SCHEMA_MISMATCH, schema.columns(),
                    values == null ? null : values.keySet()));
        }

        String keyColumn = schema.keyColumn();
        String key = values.get(keyColumn);
        if (key == null || key.isBlank()) {
            throw new SchemaException("Key column " + keyColumn + " cannot be blank");
        }

        List<String> ordered = new ArrayList<>(schema.size());
        for (String column : schema.columns()) {
            ordered.add(values.get(column) == null ? "" : values.get(column));
        }

        List<LedgerRow> rows = getAllRows();
        int rowNumber = rows.stream()
                .filter(row -> key.equals(row.get(keyColumn)))
                .mapToInt(LedgerRow::rowNumber)
                .findFirst()
                .orElseGet(() -> nextRowNumber(rows));

        backend.writeRow(rowNumber, ordered);
        log.debug("Upserted row {} in {} store {}: {}={}", rowNumber, schema.name(), storeId(), keyColumn, key);
        return toRow(rowNumber, ordered);
    }

    private void validateSchema() {
        List<List<String>> grid = backend.readAll();
        if (grid.isEmpty()) {
            throw new SchemaException(String.format("%s: store %s has no header row, expected %s",
                    Constants.ErrorMessages.SCHEMA_MISMATCH, backend.id(), schema.columns()));
        }
        List<String> headers = grid.get(0).stream().map(String::trim).toList();
        if (!headers.equals(schema.columns())) {
            throw new SchemaException(String.format("%s: store %s expected %s but got %s",
                    Constants.ErrorMessages.SCHEMA_MISMATCH, backend.id(), schema.columns(), headers));
        }
    }

    private void requireColumn(String column) {
        if (schema.indexOf(column) < 0) {
            throw new SchemaException(String.format("Column %s is not part of the %s schema %s",
                    column, schema.name(), schema.columns()));
        }
    }

    private LedgerRow toRow(int rowNumber, List<String> cells) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int c = 0; c < schema.size(); c++) {
            values.put(schema.columns().get(c), c < cells.size() && cells.get(c) != null ? cells.get(c) : "");
        }
        return new LedgerRow(rowNumber, values);
    }

    private static int nextRowNumber(List<LedgerRow> rows) {
        if (rows.isEmpty()) {
            return HEADER_ROW + 1;
        }
        return rows.get(rows.size() - 1).rowNumber() + 1;
    }

    private static boolean isBlank(List<String> cells) {
        return cells == null || cells.stream().allMatch(cell -> cell == null || cell.isBlank());
    }
}
