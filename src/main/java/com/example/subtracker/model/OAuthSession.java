package com.example.subtracker.model;

import lombok.Builder;

/**
 * User-scoped half of the OAuth state. The app access token is process-wide and stays
 * inside {@link com.example.subtracker.client.TwitchClient}.
 */
@Builder(toBuilder = true)
public record OAuthSession(String userToken, String broadcasterId, SessionState state) {

    public static final OAuthSession UNAUTHENTICATED = new OAuthSession(null, null, SessionState.UNAUTHENTICATED);

    public boolean isAuthenticated() {
        return state != SessionState.UNAUTHENTICATED;
    }
}
