package com.example.subtracker.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import com.example.subtracker.exception.AuthException;
import com.example.subtracker.exception.IdentityException;
import com.example.subtracker.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

@DisplayName("TwitchClient")
class TwitchClientTest {

    private static final TwitchCredentials CREDENTIALS =
            new TwitchCredentials("client-1", "client-secret", "https://example.test/webhook", "hub-secret");

    private MockRestServiceServer server;
    private TwitchClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new TwitchClient(restTemplate, new ObjectMapper(), CREDENTIALS);
    }

    private void expectAppToken(String token) {
        server.expect(requestTo(TwitchUrls.TOKEN.url()))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "client_id", "client-1",
                        "client_secret", "client-secret",
                        "grant_type", "client_credentials")))
                .andRespond(withSuccess("{\"access_token\":\"" + token + "\",\"expires_in\":5000}",
                        MediaType.APPLICATION_JSON));
    }

    @Nested
    @DisplayName("tokens")
    class Tokens {

        @Test
        @DisplayName("client-credentials grant returns the app token")
        void appToken() {
            expectAppToken("app-token");

            client.refreshAppAccessToken();

            assertThat(client.currentAppAccessToken()).isEqualTo("app-token");
            server.verify();
        }

        @Test
        @DisplayName("refused client-credentials grant is an auth error")
        void appTokenRefused() {
            server.expect(requestTo(TwitchUrls.TOKEN.url())).andRespond(withBadRequest());

            assertThatThrownBy(() -> client.getAppAccessToken()).isInstanceOf(AuthException.class);
        }

        @Test
        @DisplayName("app token is unavailable before the first grant")
        void noAppTokenYet() {
            assertThatThrownBy(() -> client.currentAppAccessToken()).isInstanceOf(AuthException.class);
        }

        @Test
        @DisplayName("authorization code is exchanged with the callback as redirect uri")
        void userToken() {
            server.expect(requestTo(TwitchUrls.TOKEN.url()))
                    .andExpect(content().formDataContains(Map.of(
                            "code", "abc",
                            "grant_type", "authorization_code",
                            "redirect_uri", "https://example.test/webhook")))
                    .andRespond(withSuccess("{\"access_token\":\"user-token\"}", MediaType.APPLICATION_JSON));

            assertThat(client.requestUserAccessToken("abc")).isEqualTo("user-token");
        }

        @Test
        @DisplayName("reused authorization code is an auth error")
        void reusedCode() {
            server.expect(requestTo(TwitchUrls.TOKEN.url()))
                    .andRespond(withBadRequest().body("{\"status\":400,\"message\":\"Invalid authorization code\"}"));

            assertThatThrownBy(() -> client.requestUserAccessToken("used"))
                    .isInstanceOf(AuthException.class)
                    .hasMessageContaining("already been used");
        }

        @Test
        @DisplayName("validation sends the OAuth scheme and maps rejection to false")
        void validation() {
            server.expect(requestTo(TwitchUrls.VALIDATE.url()))
                    .andExpect(header("Authorization", "OAuth good"))
                    .andRespond(withSuccess("{\"client_id\":\"client-1\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(TwitchUrls.VALIDATE.url()))
                    .andRespond(withUnauthorizedRequest());

            assertThat(client.isAccessTokenValid("good")).isTrue();
            assertThat(client.isAccessTokenValid("expired")).isFalse();
            assertThat(client.isAccessTokenValid(" ")).isFalse();
            server.verify();
        }
    }

    @Nested
    @DisplayName("identity")
    class Identity {

        @Test
        @DisplayName("broadcaster id is looked up by the token owner's login")
        void broadcasterId() {
            server.expect(requestTo(TwitchUrls.USERS.url()))
                    .andExpect(header("Client-ID", "client-1"))
                    .andExpect(header("Authorization", "Bearer user-token"))
                    .andRespond(withSuccess("{\"data\":[{\"id\":\"100\",\"login\":\"alice\"}]}",
                            MediaType.APPLICATION_JSON));
            server.expect(requestTo(TwitchUrls.USERS.url() + "?login=alice"))
                    .andRespond(withSuccess("{\"data\":[{\"id\":\"100\",\"login\":\"alice\"}]}",
                            MediaType.APPLICATION_JSON));

            assertThat(client.getBroadcasterId("user-token")).isEqualTo("100");
            server.verify();
        }

        @Test
        @DisplayName("empty user list is an identity error")
        void noUser() {
            server.expect(requestTo(TwitchUrls.USERS.url()))
                    .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.getBroadcasterId("user-token")).isInstanceOf(IdentityException.class);
        }

        @Test
        @DisplayName("unreachable users endpoint is an upstream error")
        void unreachable() {
            server.expect(requestTo(TwitchUrls.USERS.url())).andRespond(withServerError());

            assertThatThrownBy(() -> client.getUserLogin("user-token"))
                    .isInstanceOf(UpstreamUnavailableException.class);
        }

        @Test
        @DisplayName("authorize url carries client id, callback, response type and scope")
        void authUrl() {
            assertThat(client.getAuthUrl())
                    .startsWith(TwitchUrls.AUTHORIZE.url() + "?")
                    .contains("client_id=client-1")
                    .contains("redirect_uri=https://example.test/webhook")
                    .contains("response_type=code")
                    .contains("scope=channel:read:subscriptions");
        }
    }

    @Nested
    @DisplayName("EventSub")
    class EventSub {

        @Test
        @DisplayName("subscription request uses the app token and the webhook transport")
        void subscribes() {
            expectAppToken("app-token");
            server.expect(requestTo(TwitchUrls.SUBSCRIPTIONS.url()))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("Authorization", "Bearer app-token"))
                    .andExpect(header("Client-ID", "client-1"))
                    .andExpect(jsonPath("$.type").value("channel.subscription.gift"))
                    .andExpect(jsonPath("$.version").value("1"))
                    .andExpect(jsonPath("$.condition.broadcaster_user_id").value("100"))
                    .andExpect(jsonPath("$.transport.method").value("webhook"))
                    .andExpect(jsonPath("$.transport.callback").value("https://example.test/webhook"))
                    .andExpect(jsonPath("$.transport.secret").value("hub-secret"))
                    .andRespond(withStatus(HttpStatus.ACCEPTED)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"data\":[{\"status\":\"webhook_callback_verification_pending\"}]}"));

            client.refreshAppAccessToken();

            assertThat(client.subscribeToEventSub("100")).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("duplicate registration is reported as not subscribed")
        void duplicate() {
            expectAppToken("app-token");
            server.expect(requestTo(TwitchUrls.SUBSCRIPTIONS.url()))
                    .andRespond(withStatus(HttpStatus.CONFLICT));

            client.refreshAppAccessToken();

            assertThat(client.subscribeToEventSub("100")).isFalse();
        }
    }
}
