package com.example.subtracker.model;

/**
 * The EventSub payload shapes this service accepts. Anything else is rejected while parsing.
 */
public sealed interface WebhookMessage
        permits WebhookMessage.Challenge, WebhookMessage.Notification, WebhookMessage.Revocation {

    /** Callback verification: the challenge must be echoed verbatim. */
    record Challenge(String challenge) implements WebhookMessage {
    }

    record Notification(GiftEvent event) implements WebhookMessage {
    }

    /** Twitch revoked the subscription; no ledger change follows. */
    record Revocation(String subscriptionId, String status, String broadcasterId) implements WebhookMessage {
    }
}
