package com.example.subtracker.config;

import com.example.subtracker.client.TwitchClient;
import com.example.subtracker.client.TwitchCredentials;
import com.example.subtracker.util.Constants;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@Slf4j
public class TwitchConfig {

    @Value("${twitch.client-id:}")
    private String clientId;

    @Value("${twitch.client-secret:}")
    private String clientSecret;

    @Value("${twitch.webhook-secret:}")
    private String webhookSecret;

    @Value("${twitch.domain:}")
    private String domain;

    @Bean
    public TwitchCredentials twitchCredentials() {
        TwitchCredentials credentials = TwitchCredentials.forDomain(clientId, clientSecret, domain, webhookSecret);
        log.info("Twitch callback URL: {}", credentials.callbackUrl());
        return credentials;
    }

    @Bean
    public RestTemplate twitchRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Constants.Limits.REQUEST_TIMEOUT)
                .setReadTimeout(Constants.Limits.REQUEST_TIMEOUT)
                .build();
    }

    /**
     * The app token is obtained here so that startup fails when Twitch refuses the credentials.
     */
    @Bean
    public TwitchClient twitchClient(RestTemplate twitchRestTemplate,
                                     ObjectMapper objectMapper,
                                     TwitchCredentials twitchCredentials) {
        TwitchClient client = new TwitchClient(twitchRestTemplate, objectMapper, twitchCredentials);
        client.refreshAppAccessToken();
        return client;
    }
}
