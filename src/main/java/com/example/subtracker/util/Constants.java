package com.example.subtracker.util;

import java.time.Duration;

public final class Constants {

    private Constants() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static final class ErrorMessages {
        private ErrorMessages() {}

        public static final String INVALID_SIGNATURE = "Request signature could not be verified";
        public static final String MALFORMED_EVENT = "Unrecognized webhook payload";
        public static final String AUTHORIZATION_FAILED = "Authorization failed";
        public static final String IDENTITY_NOT_FOUND = "Twitch identity not found";
        public static final String GIFTER_NOT_FOUND = "Gifter not found";
        public static final String SCHEMA_MISMATCH = "Ledger schema mismatch";
        public static final String UPSTREAM_UNAVAILABLE = "Upstream service unavailable";
        public static final String NOT_AUTHORIZED = "Session is not authorized";
        public static final String UNEXPECTED_ERROR = "An unexpected error occurred";
    }

    public static final class Headers {
        private Headers() {}

        public static final String CORRELATION_ID = "X-Correlation-Id";
        public static final String MESSAGE_ID = "Twitch-Eventsub-Message-Id";
        public static final String MESSAGE_TIMESTAMP = "Twitch-Eventsub-Message-Timestamp";
        public static final String MESSAGE_SIGNATURE = "Twitch-Eventsub-Message-Signature";
        public static final String MESSAGE_TYPE = "Twitch-Eventsub-Message-Type";
        public static final String CLIENT_ID = "Client-ID";
    }

    public static final class Twitch {
        private Twitch() {}

        public static final String GIFT_EVENT_TYPE = "channel.subscription.gift";
        public static final String GIFT_EVENT_VERSION = "1";
        public static final String TRANSPORT_METHOD = "webhook";
        public static final String SCOPE = "channel:read:subscriptions";
        public static final String CALLBACK_PATH = "/webhook";
        public static final String SIGNATURE_PREFIX = "sha256=";
        public static final String MESSAGE_TYPE_REVOCATION = "revocation";
        public static final String ANONYMOUS_GIFTER_ID = "anonymous";
        public static final String ANONYMOUS_GIFTER_NAME = "Anonymous";
    }

    public static final class Limits {
        private Limits() {}

        public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);
    }

    public static final class LiveUpdates {
        private LiveUpdates() {}

        public static final String EVENT_NAME = "update_gifters";
    }

    public static final class Session {
        private Session() {}

        public static final String ACCESS_TOKEN = "access_token";
        public static final String BROADCASTER_ID = "broadcaster_id";
    }

    public static final class Mdc {
        private Mdc() {}

        public static final String CORRELATION_ID = "correlationId";
        public static final String TENANT_ID = "tenantId";
    }
}
