package com.example.subtracker.repository;

import com.example.subtracker.exception.UpstreamUnavailableException;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.model.Spreadsheet;
import com.google.api.services.sheets.v4.model.SpreadsheetProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

@Slf4j
public class SheetsTabularStoreFactory implements TabularStoreFactory {

    // Wide enough for every schema this service declares.
    private static final int MAX_COLUMNS = 26;

    private final Sheets sheets;

    public SheetsTabularStoreFactory(Sheets sheets) {
        this.sheets = sheets;
    }

    @Override
    public TabularStore open(String storeId) {
        return new SheetsTabularStore(sheets, storeId, MAX_COLUMNS);
    }

    @Override
    public TabularStore provision(String title, LedgerSchema schema) {
        Spreadsheet created;
        try {
            created = sheets.spreadsheets()
                    .create(new Spreadsheet().setProperties(new SpreadsheetProperties().setTitle(title)))
                    .setFields("spreadsheetId")
                    .execute();
        } catch (IOException e) {
            log.error("Failed to create spreadsheet '{}': {}", title, e.getMessage());
            throw new UpstreamUnavailableException("Failed to create spreadsheet " + title, e);
        }

        TabularStore store = open(created.getSpreadsheetId());
        store.writeRow(1, schema.columns());
        log.info("Provisioned spreadsheet {} ('{}') with {} schema", store.id(), title, schema.name());
        return store;
    }
}
