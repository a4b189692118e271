package com.example.subtracker.model;

import com.example.subtracker.exception.SchemaException;
import com.example.subtracker.repository.LedgerRow;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One gifter's running totals within a broadcaster's ledger.
 */
@Builder(toBuilder = true)
public record GiftLedgerEntry(String gifterId, String gifterName, int giftedSubsTotal, int rewardsGiven) {

    public static final String USER_ID = "user_id";
    public static final String USER_NAME = "user_name";
    public static final String GIFTED_SUBS = "gifted_subs";
    public static final String REWARDS_GIVEN = "rewards_given";

    public GiftLedgerEntry {
        if (gifterId == null || gifterId.isBlank()) {
            throw new IllegalArgumentException("Gifter ID cannot be null or empty");
        }
        if (giftedSubsTotal < 0) {
            throw new IllegalArgumentException("Gifted subs total cannot be negative: " + giftedSubsTotal);
        }
        if (rewardsGiven < 0) {
            throw new IllegalArgumentException("Rewards given cannot be negative: " + rewardsGiven);
        }
        gifterName = gifterName == null ? "" : gifterName;
    }

    public static GiftLedgerEntry firstGift(String gifterId, String gifterName, int giftedSubsTotal) {
        return new GiftLedgerEntry(gifterId, gifterName, giftedSubsTotal, 0);
    }

    public GiftLedgerEntry withRewardGiven() {
        return toBuilder().rewardsGiven(rewardsGiven + 1).build();
    }

    public Map<String, String> toColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(USER_ID, gifterId);
        columns.put(USER_NAME, gifterName);
        columns.put(GIFTED_SUBS, Integer.toString(giftedSubsTotal));
        columns.put(REWARDS_GIVEN, Integer.toString(rewardsGiven));
        return columns;
    }

    public static GiftLedgerEntry fromRow(LedgerRow row) {
        return new GiftLedgerEntry(
                row.get(USER_ID),
                row.get(USER_NAME),
                parseCount(row, GIFTED_SUBS),
                parseCount(row, REWARDS_GIVEN));
    }

    private static int parseCount(LedgerRow row, String column) {
        String raw = row.get(column);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new SchemaException(String.format("Negative %s '%s' in row %d", column, raw, row.rowNumber()));
            }
            return value;
        } catch (NumberFormatException e) {
            throw new SchemaException(String.format("Non-numeric %s '%s' in row %d", column, raw, row.rowNumber()), e);
        }
    }
}
