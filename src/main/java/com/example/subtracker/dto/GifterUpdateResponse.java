package com.example.subtracker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GifterUpdateResponse(
    @JsonProperty("success")
    boolean success,

    @JsonProperty("new_data")
    GifterUpdate newData
) {}
