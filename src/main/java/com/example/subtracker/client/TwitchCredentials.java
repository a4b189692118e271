package com.example.subtracker.client;

import com.example.subtracker.exception.ConfigException;
import com.example.subtracker.util.Constants;

import java.util.ArrayList;
import java.util.List;

/**
 * Application credentials registered with Twitch plus the EventSub shared secret.
 *
 * @param callbackUrl OAuth redirect URI and EventSub webhook callback; both use the same path
 */
public record TwitchCredentials(String clientId, String clientSecret, String callbackUrl, String webhookSecret) {

    public TwitchCredentials {
        List<String> missing = new ArrayList<>();
        if (isBlank(clientId)) {
            missing.add("twitch.client-id");
        }
        if (isBlank(clientSecret)) {
            missing.add("twitch.client-secret");
        }
        if (isBlank(callbackUrl)) {
            missing.add("twitch.domain");
        }
        if (isBlank(webhookSecret)) {
            missing.add("twitch.webhook-secret");
        }
        if (!missing.isEmpty()) {
            throw new ConfigException("Missing required Twitch configuration: " + String.join(", ", missing));
        }
    }

    public static TwitchCredentials forDomain(String clientId, String clientSecret, String domain, String webhookSecret) {
        String callback = isBlank(domain) ? null : stripTrailingSlash(domain) + Constants.Twitch.CALLBACK_PATH;
        return new TwitchCredentials(clientId, clientSecret, callback, webhookSecret);
    }

    @Override
    public String toString() {
        return "TwitchCredentials[clientId=" + clientId + ", callbackUrl=" + callbackUrl + "]";
    }

    private static String stripTrailingSlash(String domain) {
        return domain.endsWith("/") ? domain.substring(0, domain.length() - 1) : domain;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
