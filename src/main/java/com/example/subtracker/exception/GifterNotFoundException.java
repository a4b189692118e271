package com.example.subtracker.exception;

public class GifterNotFoundException extends RuntimeException {
    public GifterNotFoundException(String message) {
        super(message);
    }

    public GifterNotFoundException(String tenantId, String gifterId) {
        super(String.format("Gifter not found: tenantId=%s, gifterId=%s", tenantId, gifterId));
    }
}
