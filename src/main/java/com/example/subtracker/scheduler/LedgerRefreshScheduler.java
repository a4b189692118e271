package com.example.subtracker.scheduler;

import com.example.subtracker.service.TenantLedgerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Picks up tenants added to the reference table by someone other than this process.
 */
@Component
@Slf4j
public class LedgerRefreshScheduler {

    private final TenantLedgerRegistry registry;

    public LedgerRefreshScheduler(TenantLedgerRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${scheduler.registry-refresh.fixed-delay:300000}",
               initialDelayString = "${scheduler.registry-refresh.initial-delay:300000}")
    public void refreshTenantLedgers() {
        try {
            registry.refresh();
        } catch (Exception e) {
            log.error("Failed to refresh tenant ledgers: {}", e.getMessage(), e);
        }
    }
}
