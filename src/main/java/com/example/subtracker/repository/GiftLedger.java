package com.example.subtracker.repository;

import com.example.subtracker.model.GiftEvent;
import com.example.subtracker.model.GiftLedgerEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * A broadcaster's ledger of gifters. Read-modify-write sequences on one ledger are serialized
 * so concurrent deliveries for the same tenant cannot append the same gifter twice.
 */
@Slf4j
public class GiftLedger {

    private final String tenantId;
    private final LedgerStore store;
    private final Object writeLock = new Object();

    public GiftLedger(String tenantId, LedgerStore store) {
        if (!LedgerSchema.GIFTERS.equals(store.schema())) {
            throw new IllegalArgumentException("Gift ledger requires the gifters schema, got " + store.schema().name());
        }
        this.tenantId = tenantId;
        this.store = store;
    }

    public String tenantId() {
        return tenantId;
    }

    public String ledgerId() {
        return store.storeId();
    }

    public List<GiftLedgerEntry> entries() {
        return store.getAllRows().stream()
                .map(GiftLedgerEntry::fromRow)
                .toList();
    }

    public Optional<GiftLedgerEntry> find(String gifterId) {
        return store.findRow(GiftLedgerEntry.USER_ID, gifterId).map(GiftLedgerEntry::fromRow);
    }

    /**
     * Applies a gift notification. The event total replaces the stored total; rewards already
     * given are kept.
     */
    public GiftLedgerEntry recordGift(GiftEvent event) {
        synchronized (writeLock) {
            Optional<GiftLedgerEntry> existing = find(event.gifterId());
            GiftLedgerEntry entry = existing
                    .map(current -> current.toBuilder()
                            .gifterName(event.gifterName())
                            .giftedSubsTotal(event.total())
                            .build())
                    .orElseGet(() -> GiftLedgerEntry.firstGift(event.gifterId(), event.gifterName(), event.total()));

            existing.filter(current -> current.giftedSubsTotal() > event.total())
                    .ifPresent(current -> log.warn(
                            "Gift total for gifter {} in tenant {} decreased from {} to {}",
                            event.gifterId(), tenantId, current.giftedSubsTotal(), event.total()));

            store.upsert(entry.toColumns());
            return entry;
        }
    }

    public Optional<GiftLedgerEntry> incrementRewards(String gifterId) {
        synchronized (writeLock) {
            Optional<GiftLedgerEntry> updated = find(gifterId).map(GiftLedgerEntry::withRewardGiven);
            updated.ifPresent(entry -> store.upsert(entry.toColumns()));
            return updated;
        }
    }
}
