package com.example.subtracker.service;

import com.example.subtracker.dto.GifterUpdate;
import com.example.subtracker.exception.GifterNotFoundException;
import com.example.subtracker.model.GiftEvent;
import com.example.subtracker.model.GiftLedgerEntry;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class LedgerService {

    private final TenantLedgerRegistry registry;
    private final LiveUpdatePublisher liveUpdatePublisher;
    private final Counter liveUpdateFailuresTotal;

    public LedgerService(TenantLedgerRegistry registry,
                         LiveUpdatePublisher liveUpdatePublisher,
                         Counter liveUpdateFailuresTotal) {
        this.registry = registry;
        this.liveUpdatePublisher = liveUpdatePublisher;
        this.liveUpdateFailuresTotal = liveUpdateFailuresTotal;
    }

    public List<GifterUpdate> getGifters(String tenantId) {
        return registry.resolve(tenantId).entries().stream()
                .map(GifterUpdate::from)
                .toList();
    }

    /**
     * Sets a gifter's total by hand, creating the row when the gifter is new. Rewards already
     * given are kept.
     */
    public GifterUpdate setGiftedSubs(String tenantId, String gifterId, String gifterName, int giftedSubs) {
        if (gifterId == null || gifterId.trim().isEmpty()) {
            throw new IllegalArgumentException("Gifter ID cannot be null or empty");
        }

        GiftLedgerEntry entry = registry.resolve(tenantId)
                .recordGift(new GiftEvent(tenantId, gifterId, gifterName, giftedSubs));
        log.info("Gifted subs set: tenantId={}, gifterId={}, giftedSubs={}", tenantId, gifterId, giftedSubs);

        GifterUpdate update = GifterUpdate.from(entry);
        publishQuietly(tenantId, update);
        return update;
    }

    public GifterUpdate incrementRewards(String tenantId, String gifterId) {
        if (gifterId == null || gifterId.trim().isEmpty()) {
            throw new IllegalArgumentException("Gifter ID cannot be null or empty");
        }

        GiftLedgerEntry entry = registry.resolve(tenantId).incrementRewards(gifterId)
                .orElseThrow(() -> new GifterNotFoundException(tenantId, gifterId));
        log.info("Reward given: tenantId={}, gifterId={}, rewardsGiven={}", tenantId, gifterId, entry.rewardsGiven());

        GifterUpdate update = GifterUpdate.from(entry);
        publishQuietly(tenantId, update);
        return update;
    }

    private void publishQuietly(String tenantId, GifterUpdate update) {
        try {
            liveUpdatePublisher.publish(tenantId, update);
        } catch (RuntimeException e) {
            liveUpdateFailuresTotal.increment();
            log.warn("Live update failed for tenant {}, gifter {}: {}", tenantId, update.userId(), e.getMessage());
        }
    }
}
