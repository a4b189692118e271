package com.example.subtracker.service;

import com.example.subtracker.dto.GifterUpdate;

/**
 * Pushes ledger changes to viewers currently watching a broadcaster's ledger.
 * Delivery is fire-and-forget and at most once.
 */
public interface LiveUpdatePublisher {

    void publish(String tenantId, GifterUpdate update);
}
