package com.example.subtracker.model;

import com.example.subtracker.repository.LedgerRow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the reference table linking a broadcaster to the spreadsheet holding its ledger.
 */
public record TenantReference(String tenantId, String ledgerId) {

    public static final String TENANT_COLUMN = "user_id";
    public static final String LEDGER_COLUMN = "sheet_id";

    public TenantReference {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID cannot be null or empty");
        }
        if (ledgerId == null || ledgerId.isBlank()) {
            throw new IllegalArgumentException("Ledger ID cannot be null or empty");
        }
    }

    public Map<String, String> toColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(TENANT_COLUMN, tenantId);
        columns.put(LEDGER_COLUMN, ledgerId);
        return columns;
    }

    public static TenantReference fromRow(LedgerRow row) {
        return new TenantReference(row.get(TENANT_COLUMN), row.get(LEDGER_COLUMN));
    }
}
