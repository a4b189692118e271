package com.example.subtracker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionResponse(
    @JsonProperty("authorized")
    boolean authorized,

    @JsonProperty("broadcasterId")
    String broadcasterId,

    @JsonProperty("authorizeUrl")
    String authorizeUrl
) {}
