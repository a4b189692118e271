package com.example.subtracker.scheduler;

import com.example.subtracker.client.TwitchClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Validates the app access token hourly and re-obtains it once Twitch stops accepting it.
 */
@Component
@Slf4j
public class AppTokenScheduler {

    private final TwitchClient twitchClient;

    public AppTokenScheduler(TwitchClient twitchClient) {
        this.twitchClient = twitchClient;
    }

    @Scheduled(fixedDelayString = "${scheduler.app-token-validation.fixed-delay:3600000}",
               initialDelayString = "${scheduler.app-token-validation.initial-delay:3600000}")
    public void validateAppAccessToken() {
        try {
            if (twitchClient.isAccessTokenValid(twitchClient.currentAppAccessToken())) {
                log.debug("App access token is still valid");
                return;
            }
            log.warn("App access token is no longer valid, requesting a new one");
            twitchClient.refreshAppAccessToken();
        } catch (Exception e) {
            log.error("Failed to renew app access token: {}", e.getMessage(), e);
        }
    }
}
