package com.example.subtracker.service;

import com.example.subtracker.client.TwitchClient;
import com.example.subtracker.model.OAuthSession;
import com.example.subtracker.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives a broadcaster through Unauthenticated, Authenticated and Subscribed.
 */
@Service
@Slf4j
public class AuthorizationService {

    private final TwitchClient twitchClient;

    public AuthorizationService(TwitchClient twitchClient) {
        this.twitchClient = twitchClient;
    }

    public String authorizationUrl() {
        return twitchClient.getAuthUrl();
    }

    /**
     * Redeems the authorization code, resolves the broadcaster and registers the gift
     * subscription. A failed registration leaves the session Authenticated rather than
     * failing the handshake.
     */
    public OAuthSession completeAuthorization(String code) {
        try {
            String userToken = twitchClient.requestUserAccessToken(code);
            String broadcasterId = twitchClient.getBroadcasterId(userToken);
            OAuthSession session = OAuthSession.builder()
                    .userToken(userToken)
                    .broadcasterId(broadcasterId)
                    .state(SessionState.AUTHENTICATED)
                    .build();

            if (twitchClient.subscribeToEventSub(broadcasterId)) {
                session = session.toBuilder().state(SessionState.SUBSCRIBED).build();
            }
            log.info("Authorization completed: broadcasterId={}, state={}", broadcasterId, session.state());
            return session;
        } catch (RuntimeException e) {
            log.error("Failed to handle verification: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Accepts a token carried by the browser session if Twitch still considers it valid.
     */
    public Optional<OAuthSession> restoreSession(String userToken, String broadcasterId) {
        if (userToken == null || broadcasterId == null) {
            return Optional.empty();
        }
        if (!twitchClient.isAccessTokenValid(userToken)) {
            log.info("Stored user token is no longer valid: broadcasterId={}", broadcasterId);
            return Optional.empty();
        }
        return Optional.of(new OAuthSession(userToken, broadcasterId, SessionState.AUTHENTICATED));
    }
}
