package com.example.subtracker.client;

import com.example.subtracker.exception.AuthException;
import com.example.subtracker.exception.IdentityException;
import com.example.subtracker.exception.UpstreamUnavailableException;
import com.example.subtracker.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client for the Twitch OAuth and Helix endpoints this service depends on.
 * <p>
 * Every outbound call goes through {@link #makeRequest}: one attempt, bounded by the
 * RestTemplate's timeouts. A failed call is logged and comes back as an empty
 * {@link Optional}; callers decide whether that is fatal. Nothing here retries.
 */
@Slf4j
public class TwitchClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TwitchCredentials credentials;
    private final AtomicReference<String> appAccessToken = new AtomicReference<>();

    public TwitchClient(RestTemplate restTemplate, ObjectMapper objectMapper, TwitchCredentials credentials) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.credentials = credentials;
    }

    /**
     * Performs the client-credentials grant.
     *
     * @throws AuthException when Twitch is unreachable or refuses the grant
     */
    public String getAppAccessToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", credentials.clientId());
        form.add("client_secret", credentials.clientSecret());
        form.add("grant_type", "client_credentials");

        ResponseEntity<String> response = makeRequest(HttpMethod.POST, TwitchUrls.TOKEN.uri(), formHeaders(), form)
                .orElseThrow(() -> new AuthException("Failed to get app access token"));
        return requireAccessToken(response, "app access token");
    }

    /**
     * Obtains a fresh app token and makes it the one used for EventSub calls.
     */
    public void refreshAppAccessToken() {
        appAccessToken.set(getAppAccessToken());
        log.info("App access token obtained for client {}", credentials.clientId());
    }

    public String currentAppAccessToken() {
        String token = appAccessToken.get();
        if (token == null) {
            throw new AuthException("App access token has not been obtained");
        }
        return token;
    }

    /**
     * @return false when Twitch rejects the token or cannot be reached
     */
    public boolean isAccessTokenValid(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "OAuth " + token);
        return makeRequest(HttpMethod.GET, TwitchUrls.VALIDATE.uri(), headers, null)
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .orElse(false);
    }

    public String getAuthUrl() {
        return UriComponentsBuilder.fromUriString(TwitchUrls.AUTHORIZE.url())
                .queryParam("client_id", credentials.clientId())
                .queryParam("redirect_uri", credentials.callbackUrl())
                .queryParam("response_type", "code")
                .queryParam("scope", Constants.Twitch.SCOPE)
                .encode()
                .build()
                .toUriString();
    }

    /**
     * Exchanges a one-time authorization code for a user token. Twitch refuses a code that
     * was already redeemed; that surfaces here as {@link AuthException}.
     */
    public String requestUserAccessToken(String code) {
        if (code == null || code.isBlank()) {
            throw new AuthException("Authorization code cannot be empty");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", credentials.clientId());
        form.add("client_secret", credentials.clientSecret());
        form.add("code", code);
        form.add("grant_type", "authorization_code");
        form.add("redirect_uri", credentials.callbackUrl());

        ResponseEntity<String> response = makeRequest(HttpMethod.POST, TwitchUrls.TOKEN.uri(), formHeaders(), form)
                .orElseThrow(() -> new AuthException("Authorization code was rejected or has already been used"));
        return requireAccessToken(response, "user access token");
    }

    public String getUserLogin(String userToken) {
        ResponseEntity<String> response = makeRequest(HttpMethod.GET, TwitchUrls.USERS.uri(), userHeaders(userToken), null)
                .orElseThrow(() -> new UpstreamUnavailableException("Failed to get Twitch user"));

        JsonNode data = readTree(response).path("data");
        if (!data.isArray() || data.isEmpty() || data.get(0).path("login").asText("").isEmpty()) {
            throw new IdentityException("Twitch returned no user for the access token");
        }
        return data.get(0).path("login").asText();
    }

    /**
     * Resolves the numeric broadcaster id of the user owning {@code userToken}.
     *
     * @throws IdentityException when Twitch has no user for the token's login
     */
    public String getBroadcasterId(String userToken) {
        String login = getUserLogin(userToken);
        URI uri = UriComponentsBuilder.fromUriString(TwitchUrls.USERS.url())
                .queryParam("login", login)
                .encode()
                .build()
                .toUri();

        ResponseEntity<String> response = makeRequest(HttpMethod.GET, uri, userHeaders(userToken), null)
                .orElseThrow(() -> new UpstreamUnavailableException("Failed to look up broadcaster " + login));

        JsonNode data = readTree(response).path("data");
        if (!data.isArray() || data.isEmpty() || data.get(0).path("id").asText("").isEmpty()) {
            log.error("No broadcaster found with name {}", login);
            throw new IdentityException("No broadcaster found with login " + login);
        }
        return data.get(0).path("id").asText();
    }

    /**
     * Registers the gift-subscription webhook for a broadcaster. Twitch answers a duplicate
     * registration with 409; like any other failure it is logged and reported as false.
     */
    public boolean subscribeToEventSub(String broadcasterId) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(Constants.Headers.CLIENT_ID, credentials.clientId());
        headers.setBearerAuth(currentAppAccessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> transport = new LinkedHashMap<>();
        transport.put("method", Constants.Twitch.TRANSPORT_METHOD);
        transport.put("callback", credentials.callbackUrl());
        transport.put("secret", credentials.webhookSecret());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", Constants.Twitch.GIFT_EVENT_TYPE);
        payload.put("version", Constants.Twitch.GIFT_EVENT_VERSION);
        payload.put("condition", Map.of("broadcaster_user_id", broadcasterId));
        payload.put("transport", transport);

        boolean subscribed = makeRequest(HttpMethod.POST, TwitchUrls.SUBSCRIPTIONS.uri(), headers, payload)
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .orElse(false);

        if (subscribed) {
            log.info("EventSub subscription successful: broadcasterId={}", broadcasterId);
        } else {
            log.error("EventSub subscription failed: broadcasterId={}", broadcasterId);
        }
        return subscribed;
    }

    Optional<ResponseEntity<String>> makeRequest(HttpMethod method, URI uri, HttpHeaders headers, Object body) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, method, new HttpEntity<>(body, headers), String.class);
            log.info("Successful {} request to {}", method, uri);
            return Optional.of(response);
        } catch (RestClientException e) {
            log.error("Failed {} request to {}: {}", method, uri, e.getMessage());
            return Optional.empty();
        }
    }

    private String requireAccessToken(ResponseEntity<String> response, String description) {
        String token = readTree(response).path("access_token").asText("");
        if (token.isEmpty()) {
            throw new AuthException("Twitch response did not contain an " + description);
        }
        return token;
    }

    private JsonNode readTree(ResponseEntity<String> response) {
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new UpstreamUnavailableException("Empty response body from Twitch");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("Unreadable response from Twitch", e);
        }
    }

    private HttpHeaders formHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return headers;
    }

    private HttpHeaders userHeaders(String userToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(Constants.Headers.CLIENT_ID, credentials.clientId());
        headers.setBearerAuth(userToken);
        return headers;
    }
}
