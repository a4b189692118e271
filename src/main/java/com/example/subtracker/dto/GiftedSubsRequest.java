package com.example.subtracker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record GiftedSubsRequest(
    @NotBlank(message = "user_name is required")
    @JsonProperty("user_name")
    String userName,

    @NotNull(message = "gifted_subs is required")
    @Min(value = 0, message = "gifted_subs cannot be negative")
    @JsonProperty("gifted_subs")
    Integer giftedSubs
) {}
