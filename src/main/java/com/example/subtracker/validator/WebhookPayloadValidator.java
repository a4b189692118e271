package com.example.subtracker.validator;

import com.example.subtracker.exception.MalformedEventException;
import com.example.subtracker.model.GiftEvent;
import com.example.subtracker.model.WebhookMessage;
import com.example.subtracker.util.Constants;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Turns a verified webhook body into a {@link WebhookMessage}. Unknown shapes are rejected
 * here, before any field reaches the ledger.
 */
@Component
public class WebhookPayloadValidator {

    private final ObjectMapper objectMapper;

    public WebhookPayloadValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param messageType value of the {@code Twitch-Eventsub-Message-Type} header; a
     *                    subscription status is only read as a revocation when this says so
     */
    public WebhookMessage parse(byte[] rawBody, String messageType) {
        if (rawBody == null || rawBody.length == 0) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": body is not a JSON object");
        }

        if (root.has("challenge")) {
            JsonNode challenge = root.get("challenge");
            if (!challenge.isTextual()) {
                throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": challenge must be a string");
            }
            return new WebhookMessage.Challenge(challenge.asText());
        }

        if (root.has("event")) {
            return new WebhookMessage.Notification(parseGiftEvent(root));
        }

        JsonNode subscription = root.path("subscription");
        if (Constants.Twitch.MESSAGE_TYPE_REVOCATION.equals(messageType)
                && subscription.isObject() && subscription.hasNonNull("status")) {
            return new WebhookMessage.Revocation(
                    textOrNull(subscription, "id"),
                    subscription.get("status").asText(),
                    textOrNull(subscription.path("condition"), "broadcaster_user_id"));
        }

        throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT
                + ": expected a challenge, event or subscription revocation, got message type " + messageType);
    }

    private GiftEvent parseGiftEvent(JsonNode root) {
        JsonNode event = root.get("event");
        if (!event.isObject()) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": event must be an object");
        }

        String gifterId;
        String gifterName;
        if (event.path("is_anonymous").asBoolean(false) && textOrNull(event, "user_id") == null) {
            gifterId = Constants.Twitch.ANONYMOUS_GIFTER_ID;
            gifterName = Constants.Twitch.ANONYMOUS_GIFTER_NAME;
        } else {
            gifterId = requireText(event, "user_id");
            gifterName = requireText(event, "user_name");
        }

        JsonNode total = event.get("total");
        if (total == null || !total.canConvertToInt() || !total.isIntegralNumber()) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": total must be an integer");
        }
        if (total.asInt() < 0) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": total cannot be negative");
        }

        String broadcasterId = textOrNull(event, "broadcaster_user_id");
        if (broadcasterId == null) {
            broadcasterId = textOrNull(root.path("subscription").path("condition"), "broadcaster_user_id");
        }
        return new GiftEvent(broadcasterId, gifterId, gifterName, total.asInt());
    }

    private static String requireText(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new MalformedEventException(Constants.ErrorMessages.MALFORMED_EVENT + ": missing " + field);
        }
        return value;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
