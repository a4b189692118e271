package com.example.subtracker.service;

import com.example.subtracker.dto.GifterUpdate;
import com.example.subtracker.exception.MalformedEventException;
import com.example.subtracker.model.GiftEvent;
import com.example.subtracker.model.GiftLedgerEntry;
import com.example.subtracker.model.IngestionOutcome;
import com.example.subtracker.model.WebhookMessage;
import com.example.subtracker.repository.GiftLedger;
import com.example.subtracker.util.Constants;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Applies verified EventSub deliveries to the broadcaster's ledger.
 */
@Service
@Slf4j
public class EventIngestionService {

    private final TenantLedgerRegistry registry;
    private final LiveUpdatePublisher liveUpdatePublisher;
    private final Counter webhookNotificationsTotal;
    private final Counter liveUpdateFailuresTotal;

    public EventIngestionService(TenantLedgerRegistry registry,
                                 LiveUpdatePublisher liveUpdatePublisher,
                                 Counter webhookNotificationsTotal,
                                 Counter liveUpdateFailuresTotal) {
        this.registry = registry;
        this.liveUpdatePublisher = liveUpdatePublisher;
        this.webhookNotificationsTotal = webhookNotificationsTotal;
        this.liveUpdateFailuresTotal = liveUpdateFailuresTotal;
    }

    /**
     * Handles a message whose tenant is carried in the payload itself.
     */
    public IngestionOutcome handle(WebhookMessage message) {
        String tenantId = null;
        if (message instanceof WebhookMessage.Notification notification) {
            tenantId = notification.event().broadcasterId();
        } else if (message instanceof WebhookMessage.Revocation revocation) {
            tenantId = revocation.broadcasterId();
        }
        return handle(tenantId, message);
    }

    public IngestionOutcome handle(String tenantId, WebhookMessage message) {
        if (message instanceof WebhookMessage.Challenge challenge) {
            log.info("Answering EventSub callback verification challenge");
            return IngestionOutcome.challenge(challenge.challenge());
        }
        if (message instanceof WebhookMessage.Revocation revocation) {
            log.warn("EventSub subscription revoked: subscriptionId={}, status={}, tenantId={}",
                    revocation.subscriptionId(), revocation.status(), tenantId);
            return IngestionOutcome.revoked();
        }
        if (message instanceof WebhookMessage.Notification notification) {
            return recordGift(tenantId, notification.event());
        }
        throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT);
    }

    private IngestionOutcome recordGift(String tenantId, GiftEvent event) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT
                    + ": notification does not name a broadcaster");
        }
        MDC.put(Constants.Mdc.TENANT_ID, tenantId);
        try {
            GiftLedger ledger = registry.resolve(tenantId);
            GiftLedgerEntry entry = ledger.recordGift(event);
            webhookNotificationsTotal.increment();
            log.info("Gift recorded: tenantId={}, gifterId={}, giftedSubs={}, rewardsGiven={}",
                    tenantId, entry.gifterId(), entry.giftedSubsTotal(), entry.rewardsGiven());

            publishQuietly(tenantId, entry);
            return IngestionOutcome.recorded(entry);
        } finally {
            MDC.remove(Constants.Mdc.TENANT_ID);
        }
    }

    private void publishQuietly(String tenantId, GiftLedgerEntry entry) {
        try {
            liveUpdatePublisher.publish(tenantId, GifterUpdate.from(entry));
        } catch (RuntimeException e) {
            liveUpdateFailuresTotal.increment();
            log.warn("Live update failed for tenant {}, gifter {}: {}", tenantId, entry.gifterId(), e.getMessage());
        }
    }
}
