package com.example.subtracker.validator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.subtracker.exception.MalformedEventException;
import com.example.subtracker.model.GiftEvent;
import com.example.subtracker.model.WebhookMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WebhookPayloadValidator")
class WebhookPayloadValidatorTest {

    private final WebhookPayloadValidator validator = new WebhookPayloadValidator(new ObjectMapper());

    private WebhookMessage parse(String json) {
        return parse(json, "notification");
    }

    private WebhookMessage parse(String json, String messageType) {
        return validator.parse(json.getBytes(StandardCharsets.UTF_8), messageType);
    }

    @Nested
    @DisplayName("recognized shapes")
    class Recognized {

        @Test
        @DisplayName("challenge")
        void challenge() {
            assertThat(parse("{\"challenge\":\"pogchamp-kappa-360noscope-vohiyo\",\"subscription\":{}}"))
                    .isEqualTo(new WebhookMessage.Challenge("pogchamp-kappa-360noscope-vohiyo"));
        }

        @Test
        @DisplayName("gift notification with broadcaster on the event")
        void notification() {
            WebhookMessage message = parse("""
                    {"subscription":{"type":"channel.subscription.gift","condition":{"broadcaster_user_id":"999"}},
                     "event":{"user_id":"1","user_name":"alice","broadcaster_user_id":"100","total":5,"tier":"1000"}}
                    """);

            assertThat(message).isEqualTo(new WebhookMessage.Notification(new GiftEvent("100", "1", "alice", 5)));
        }

        @Test
        @DisplayName("broadcaster falls back to the subscription condition")
        void broadcasterFromCondition() {
            WebhookMessage message = parse("""
                    {"subscription":{"condition":{"broadcaster_user_id":"999"}},
                     "event":{"user_id":"1","user_name":"alice","total":2}}
                    """);

            assertThat(((WebhookMessage.Notification) message).event().broadcasterId()).isEqualTo("999");
        }

        @Test
        @DisplayName("revocation")
        void revocation() {
            WebhookMessage message = parse("""
                    {"subscription":{"id":"sub-1","status":"authorization_revoked",
                     "condition":{"broadcaster_user_id":"100"}}}
                    """, "revocation");

            assertThat(message).isEqualTo(new WebhookMessage.Revocation("sub-1", "authorization_revoked", "100"));
        }

        @Test
        @DisplayName("anonymous gift is recorded under the shared anonymous gifter")
        void anonymousGift() {
            WebhookMessage message = parse("""
                    {"subscription":{"condition":{"broadcaster_user_id":"100"}},
                     "event":{"user_id":null,"user_name":null,"broadcaster_user_id":"100",
                              "total":3,"is_anonymous":true}}
                    """);

            assertThat(message).isEqualTo(new WebhookMessage.Notification(
                    new GiftEvent("100", "anonymous", "Anonymous", 3)));
        }
    }

    @Nested
    @DisplayName("malformed payloads")
    class Malformed {

        @Test
        @DisplayName("empty body")
        void empty() {
            assertThatThrownBy(() -> validator.parse(new byte[0], "notification")).isInstanceOf(MalformedEventException.class);
        }

        @Test
        @DisplayName("invalid JSON")
        void invalidJson() {
            assertThatThrownBy(() -> parse("{not json")).isInstanceOf(MalformedEventException.class);
        }

        @Test
        @DisplayName("none of challenge, event or subscription status")
        void unknownShape() {
            assertThatThrownBy(() -> parse("{\"hello\":\"world\"}")).isInstanceOf(MalformedEventException.class);
            assertThatThrownBy(() -> parse("[1,2]")).isInstanceOf(MalformedEventException.class);
        }

        @Test
        @DisplayName("subscription status outside a revocation message")
        void statusWithoutRevocation() {
            assertThatThrownBy(() -> parse("{\"subscription\":{\"id\":\"sub-1\",\"status\":\"enabled\"}}"))
                    .isInstanceOf(MalformedEventException.class);
            assertThatThrownBy(() -> parse("{\"subscription\":{\"status\":\"enabled\"}}", null))
                    .isInstanceOf(MalformedEventException.class);
        }

        @Test
        @DisplayName("event missing user_id without the anonymous flag")
        void missingIdNotAnonymous() {
            assertThatThrownBy(() -> parse("{\"event\":{\"user_id\":null,\"user_name\":\"a\",\"total\":1}}"))
                    .isInstanceOf(MalformedEventException.class)
                    .hasMessageContaining("user_id");
        }

        @Test
        @DisplayName("event missing user_name")
        void missingName() {
            assertThatThrownBy(() -> parse("{\"event\":{\"user_id\":\"1\",\"total\":1}}"))
                    .isInstanceOf(MalformedEventException.class)
                    .hasMessageContaining("user_name");
        }

        @Test
        @DisplayName("total that is not a non-negative integer")
        void badTotal() {
            assertThatThrownBy(() -> parse("{\"event\":{\"user_id\":\"1\",\"user_name\":\"a\",\"total\":\"5\"}}"))
                    .isInstanceOf(MalformedEventException.class);
            assertThatThrownBy(() -> parse("{\"event\":{\"user_id\":\"1\",\"user_name\":\"a\",\"total\":1.5}}"))
                    .isInstanceOf(MalformedEventException.class);
            assertThatThrownBy(() -> parse("{\"event\":{\"user_id\":\"1\",\"user_name\":\"a\",\"total\":-1}}"))
                    .isInstanceOf(MalformedEventException.class);
            assertThatThrownBy(() -> parse("{\"event\":{\"user_id\":\"1\",\"user_name\":\"a\"}}"))
                    .isInstanceOf(MalformedEventException.class);
        }

        @Test
        @DisplayName("non-string challenge")
        void numericChallenge() {
            assertThatThrownBy(() -> parse("{\"challenge\":42}")).isInstanceOf(MalformedEventException.class);
        }
    }
}
