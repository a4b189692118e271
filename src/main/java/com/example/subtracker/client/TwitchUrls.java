package com.example.subtracker.client;

import java.net.URI;

public enum TwitchUrls {
    VALIDATE("https://id.twitch.tv/oauth2/validate"),
    AUTHORIZE("https://id.twitch.tv/oauth2/authorize"),
    TOKEN("https://id.twitch.tv/oauth2/token"),
    USERS("https://api.twitch.tv/helix/users"),
    SUBSCRIPTIONS("https://api.twitch.tv/helix/eventsub/subscriptions");

    private final String url;

    TwitchUrls(String url) {
        this.url = url;
    }

    public String url() {
        return url;
    }

    public URI uri() {
        return URI.create(url);
    }
}
