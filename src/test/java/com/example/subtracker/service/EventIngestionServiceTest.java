package com.example.subtracker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.subtracker.dto.GifterUpdate;
import com.example.subtracker.exception.MalformedEventException;
import com.example.subtracker.model.GiftEvent;
import com.example.subtracker.model.GiftLedgerEntry;
import com.example.subtracker.model.IngestionOutcome;
import com.example.subtracker.model.WebhookMessage;
import com.example.subtracker.repository.InMemoryTabularStore;
import com.example.subtracker.repository.InMemoryTabularStoreFactory;
import com.example.subtracker.repository.LedgerSchema;
import com.example.subtracker.repository.LedgerStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventIngestionService")
class EventIngestionServiceTest {

    private TenantLedgerRegistry registry;
    private LiveUpdatePublisher publisher;
    private Counter notifications;
    private Counter liveUpdateFailures;
    private EventIngestionService service;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        registry = new TenantLedgerRegistry(
                new LedgerStore(InMemoryTabularStore.withHeader("reference", LedgerSchema.REFERENCE),
                        LedgerSchema.REFERENCE),
                new InMemoryTabularStoreFactory(),
                meters.counter("ledgers_provisioned_total"));
        publisher = mock(LiveUpdatePublisher.class);
        notifications = meters.counter("webhook_notifications_total");
        liveUpdateFailures = meters.counter("live_update_failures_total");
        service = new EventIngestionService(registry, publisher, notifications, liveUpdateFailures);
    }

    @Test
    @DisplayName("challenge is echoed without touching any ledger")
    void challenge() {
        IngestionOutcome outcome = service.handle(new WebhookMessage.Challenge("abc123"));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.CHALLENGE_ANSWERED);
        assertThat(outcome.responseBody()).isEqualTo("abc123");
        assertThat(registry.knownTenants()).isEmpty();
    }

    @Test
    @DisplayName("notification is recorded in the broadcaster's ledger and published")
    void notification() {
        IngestionOutcome outcome = service.handle(
                new WebhookMessage.Notification(new GiftEvent("100", "1", "alice", 5)));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.RECORDED);
        assertThat(outcome.responseBody()).isEqualTo("OK");
        assertThat(registry.resolve("100").entries()).containsExactly(new GiftLedgerEntry("1", "alice", 5, 0));
        assertThat(notifications.count()).isEqualTo(1.0);
        verify(publisher).publish("100", new GifterUpdate("1", "alice", 5, 0));
    }

    @Test
    @DisplayName("tenants are isolated from each other")
    void isolation() {
        service.handle(new WebhookMessage.Notification(new GiftEvent("100", "1", "alice", 5)));
        service.handle(new WebhookMessage.Notification(new GiftEvent("200", "1", "alice", 2)));

        assertThat(registry.resolve("100").entries()).containsExactly(new GiftLedgerEntry("1", "alice", 5, 0));
        assertThat(registry.resolve("200").entries()).containsExactly(new GiftLedgerEntry("1", "alice", 2, 0));
        assertThat(registry.resolve("100").ledgerId()).isNotEqualTo(registry.resolve("200").ledgerId());
    }

    @Test
    @DisplayName("publisher failure does not fail the delivery")
    void publishFailureIsContained() {
        doThrow(new IllegalStateException("socket closed")).when(publisher).publish(anyString(), any());

        IngestionOutcome outcome = service.handle(
                new WebhookMessage.Notification(new GiftEvent("100", "1", "alice", 5)));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.RECORDED);
        assertThat(liveUpdateFailures.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("revocation is acknowledged without a ledger write")
    void revocation() {
        IngestionOutcome outcome = service.handle(
                new WebhookMessage.Revocation("sub-1", "authorization_revoked", "100"));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.REVOKED);
        assertThat(registry.knownTenants()).isEmpty();
        verify(publisher, never()).publish(anyString(), any());
    }

    @Test
    @DisplayName("notification without a broadcaster is malformed")
    void missingBroadcaster() {
        assertThatThrownBy(() -> service.handle(
                new WebhookMessage.Notification(new GiftEvent(null, "1", "alice", 5))))
                .isInstanceOf(MalformedEventException.class);
        assertThat(notifications.count()).isZero();
    }
}
