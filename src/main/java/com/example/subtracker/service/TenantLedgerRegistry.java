package com.example.subtracker.service;

import com.example.subtracker.exception.SchemaException;
import com.example.subtracker.exception.UpstreamUnavailableException;
import com.example.subtracker.model.TenantReference;
import com.example.subtracker.repository.GiftLedger;
import com.example.subtracker.repository.LedgerRow;
import com.example.subtracker.repository.LedgerSchema;
import com.example.subtracker.repository.LedgerStore;
import com.example.subtracker.repository.TabularStore;
import com.example.subtracker.repository.TabularStoreFactory;
import io.micrometer.core.instrument.Counter;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps broadcaster ids to their gift ledgers.
 * <p>
 * The reference table is the durable source of truth; the in-memory map is a cache in front
 * of it. A miss re-reads the reference table and, when the tenant is still unknown, creates a
 * new spreadsheet and appends a reference row for it. Resolution of one tenant id runs under
 * that id's own lock, so a burst of first deliveries provisions a single ledger while other
 * tenants resolve in parallel.
 */
@Service
@Slf4j
public class TenantLedgerRegistry {

    private final LedgerStore referenceStore;
    private final TabularStoreFactory storeFactory;
    private final Counter ledgersProvisionedTotal;

    private final ConcurrentMap<String, GiftLedger> ledgers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> resolutionLocks = new ConcurrentHashMap<>();
    private final Object referenceWriteLock = new Object();

    public TenantLedgerRegistry(LedgerStore referenceStore,
                                TabularStoreFactory storeFactory,
                                Counter ledgersProvisionedTotal) {
        if (!LedgerSchema.REFERENCE.equals(referenceStore.schema())) {
            throw new IllegalArgumentException("Reference store requires the reference schema, got "
                    + referenceStore.schema().name());
        }
        this.referenceStore = referenceStore;
        this.storeFactory = storeFactory;
        this.ledgersProvisionedTotal = ledgersProvisionedTotal;
    }

    @PostConstruct
    public void initialize() {
        log.info("Loading tenant ledgers from reference table {}", referenceStore.storeId());
        refresh();
    }

    public GiftLedger resolve(String tenantId) {
        if (tenantId == null || tenantId.trim().isEmpty()) {
            throw new IllegalArgumentException("Tenant ID cannot be null or empty");
        }

        GiftLedger cached = ledgers.get(tenantId);
        if (cached != null) {
            return cached;
        }

        Object lock = resolutionLocks.computeIfAbsent(tenantId, id -> new Object());
        synchronized (lock) {
            cached = ledgers.get(tenantId);
            if (cached != null) {
                return cached;
            }

            Optional<TenantReference> reference = referenceStore
                    .findRow(TenantReference.TENANT_COLUMN, tenantId)
                    .map(TenantReference::fromRow);

            GiftLedger ledger;
            if (reference.isPresent()) {
                log.info("Found ledger {} for tenant {} in reference table", reference.get().ledgerId(), tenantId);
                ledger = open(reference.get());
            } else {
                ledger = provision(tenantId);
            }
            ledgers.put(tenantId, ledger);
            return ledger;
        }
    }

    /**
     * Loads every tenant in the reference table that is not cached yet, or whose ledger id
     * changed. A ledger that cannot be opened is logged and skipped; resolving it later raises
     * the error to that caller only. Entries are never evicted here, and an entry installed by a
     * concurrent {@link #resolve} wins over the one opened by this refresh.
     */
    public void refresh() {
        int loaded = 0;
        int skipped = 0;
        for (LedgerRow row : referenceStore.getAllRows()) {
            TenantReference reference;
            try {
                reference = TenantReference.fromRow(row);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping incomplete reference row {}: {}", row.rowNumber(), e.getMessage());
                skipped++;
                continue;
            }

            GiftLedger current = ledgers.get(reference.tenantId());
            if (current != null && current.ledgerId().equals(reference.ledgerId())) {
                loaded++;
                continue;
            }
            try {
                GiftLedger opened = open(reference);
                if (current == null) {
                    ledgers.putIfAbsent(reference.tenantId(), opened);
                } else {
                    ledgers.replace(reference.tenantId(), current, opened);
                }
                loaded++;
            } catch (SchemaException | UpstreamUnavailableException e) {
                log.error("Ledger {} for tenant {} is unusable: {}",
                        reference.ledgerId(), reference.tenantId(), e.getMessage());
                skipped++;
            }
        }
        log.info("Tenant ledger map refreshed: {} tenants, {} skipped", loaded, skipped);
    }

    public Set<String> knownTenants() {
        return Set.copyOf(ledgers.keySet());
    }

    private GiftLedger open(TenantReference reference) {
        TabularStore backend = storeFactory.open(reference.ledgerId());
        return new GiftLedger(reference.tenantId(), new LedgerStore(backend, LedgerSchema.GIFTERS));
    }

    private GiftLedger provision(String tenantId) {
        log.info("No ledger for tenant {}, provisioning a new one", tenantId);
        TabularStore backend = storeFactory.provision(tenantId + "_sheet", LedgerSchema.GIFTERS);
        GiftLedger ledger = new GiftLedger(tenantId, new LedgerStore(backend, LedgerSchema.GIFTERS));

        synchronized (referenceWriteLock) {
            referenceStore.upsert(new TenantReference(tenantId, backend.id()).toColumns());
        }

        ledgersProvisionedTotal.increment();
        log.info("Provisioned ledger {} for tenant {}", backend.id(), tenantId);
        return ledger;
    }
}
