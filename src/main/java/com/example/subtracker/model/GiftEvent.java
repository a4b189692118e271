package com.example.subtracker.model;

/**
 * Normalized {@code channel.subscription.gift} notification.
 *
 * @param broadcasterId the receiving channel, or {@code null} when the payload omits it
 * @param total         subscriptions gifted to date by this gifter
 */
public record GiftEvent(String broadcasterId, String gifterId, String gifterName, int total) {
}
