package com.example.subtracker.service;

import com.example.subtracker.dto.GifterUpdate;
import com.example.subtracker.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server-Sent Events fan-out, one emitter list per broadcaster.
 */
@Service
@Slf4j
public class SseLiveUpdatePublisher implements LiveUpdatePublisher {

    private final long emitterTimeoutMillis;
    private final ConcurrentMap<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

    public SseLiveUpdatePublisher(@Value("${live-updates.emitter-timeout:1800000}") long emitterTimeoutMillis) {
        this.emitterTimeoutMillis = emitterTimeoutMillis;
    }

    public SseEmitter subscribe(String tenantId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        List<SseEmitter> tenantEmitters = emitters.computeIfAbsent(tenantId, id -> new CopyOnWriteArrayList<>());
        tenantEmitters.add(emitter);

        emitter.onCompletion(() -> tenantEmitters.remove(emitter));
        emitter.onTimeout(() -> tenantEmitters.remove(emitter));
        emitter.onError(error -> tenantEmitters.remove(emitter));

        log.debug("Live update subscriber added: tenantId={}, subscribers={}", tenantId, tenantEmitters.size());
        return emitter;
    }

    @Override
    public void publish(String tenantId, GifterUpdate update) {
        List<SseEmitter> tenantEmitters = emitters.get(tenantId);
        if (tenantEmitters == null || tenantEmitters.isEmpty()) {
            log.debug("No live update subscribers for tenant {}", tenantId);
            return;
        }

        for (SseEmitter emitter : tenantEmitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(Constants.LiveUpdates.EVENT_NAME)
                        .data(update));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping live update subscriber for tenant {}: {}", tenantId, e.getMessage());
                tenantEmitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
    }

    public int subscriberCount(String tenantId) {
        List<SseEmitter> tenantEmitters = emitters.get(tenantId);
        return tenantEmitters == null ? 0 : tenantEmitters.size();
    }
}
