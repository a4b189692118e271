package com.example.subtracker.repository;

import com.example.subtracker.exception.UpstreamUnavailableException;
import com.example.subtracker.util.A1Notation;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.model.ValueRange;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TabularStore} over the first sheet of a Google spreadsheet.
 */
@Slf4j
public class SheetsTabularStore implements TabularStore {

    // Cell values are stored verbatim; user-supplied names are never interpreted as formulas.
    static final String VALUE_INPUT_OPTION = "RAW";

    private final Sheets sheets;
    private final String spreadsheetId;
    private final int columnCount;

    public SheetsTabularStore(Sheets sheets, String spreadsheetId, int columnCount) {
        if (spreadsheetId == null || spreadsheetId.isBlank()) {
            throw new IllegalArgumentException("Spreadsheet ID cannot be null or empty");
        }
        this.sheets = sheets;
        this.spreadsheetId = spreadsheetId;
        this.columnCount = columnCount;
    }

    @Override
    public String id() {
        return spreadsheetId;
    }

    @Override
    public List<List<String>> readAll() {
        try {
            ValueRange result = sheets.spreadsheets().values()
                    .get(spreadsheetId, A1Notation.columnsRange(columnCount))
                    .execute();
            List<List<Object>> values = result.getValues();
            if (values == null) {
                return List.of();
            }
            List<List<String>> grid = new ArrayList<>(values.size());
            for (List<Object> row : values) {
                grid.add(row.stream().map(cell -> cell == null ? "" : cell.toString()).toList());
            }
            return grid;
        } catch (IOException e) {
            log.error("Failed to read spreadsheet {}: {}", spreadsheetId, e.getMessage());
            throw new UpstreamUnavailableException("Failed to read spreadsheet " + spreadsheetId, e);
        }
    }

    @Override
    public void writeRow(int rowNumber, List<String> values) {
        String range = A1Notation.rowRange(rowNumber, values.size());
        List<List<Object>> body = List.of(new ArrayList<Object>(values));
        try {
            sheets.spreadsheets().values()
                    .update(spreadsheetId, range, new ValueRange().setValues(body))
                    .setValueInputOption(VALUE_INPUT_OPTION)
                    .execute();
            log.info("Wrote {} cells to spreadsheet {} at {}", values.size(), spreadsheetId, range);
        } catch (IOException e) {
            log.error("Failed to write spreadsheet {} at {}: {}", spreadsheetId, range, e.getMessage());
            throw new UpstreamUnavailableException("Failed to write spreadsheet " + spreadsheetId, e);
        }
    }
}
