package com.example.subtracker.model;

/**
 * Result of handling one webhook delivery.
 *
 * @param responseBody plain-text body returned to Twitch
 * @param entry        ledger entry written, only for {@link Status#RECORDED}
 */
public record IngestionOutcome(Status status, String responseBody, GiftLedgerEntry entry) {

    public static final String ACKNOWLEDGED_BODY = "OK";

    public enum Status {
        CHALLENGE_ANSWERED,
        RECORDED,
        REVOKED
    }

    public static IngestionOutcome challenge(String challenge) {
        return new IngestionOutcome(Status.CHALLENGE_ANSWERED, challenge, null);
    }

    public static IngestionOutcome recorded(GiftLedgerEntry entry) {
        return new IngestionOutcome(Status.RECORDED, ACKNOWLEDGED_BODY, entry);
    }

    public static IngestionOutcome revoked() {
        return new IngestionOutcome(Status.REVOKED, ACKNOWLEDGED_BODY, null);
    }
}
