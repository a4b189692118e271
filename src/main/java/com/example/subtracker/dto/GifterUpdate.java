package com.example.subtracker.dto;

import com.example.subtracker.model.GiftLedgerEntry;
import com.fasterxml.jackson.annotation.JsonProperty;

public record GifterUpdate(
    @JsonProperty("user_id")
    String userId,

    @JsonProperty("user_name")
    String userName,

    @JsonProperty("gifted_subs")
    int giftedSubs,

    @JsonProperty("rewards_given")
    int rewardsGiven
) {
    public static GifterUpdate from(GiftLedgerEntry entry) {
        return new GifterUpdate(entry.gifterId(), entry.gifterName(), entry.giftedSubsTotal(), entry.rewardsGiven());
    }
}
