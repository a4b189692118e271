package com.example.subtracker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.example.subtracker.dto.GifterUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@DisplayName("SseLiveUpdatePublisher")
class SseLiveUpdatePublisherTest {

    private final SseLiveUpdatePublisher publisher = new SseLiveUpdatePublisher(60_000L);

    @Test
    @DisplayName("subscribers are tracked per tenant")
    void perTenant() {
        publisher.subscribe("100");
        publisher.subscribe("100");
        publisher.subscribe("200");

        assertThat(publisher.subscriberCount("100")).isEqualTo(2);
        assertThat(publisher.subscriberCount("200")).isEqualTo(1);
        assertThat(publisher.subscriberCount("300")).isZero();
    }

    @Test
    @DisplayName("publishing with no subscribers is a no-op")
    void noSubscribers() {
        assertThatCode(() -> publisher.publish("100", new GifterUpdate("1", "alice", 5, 0)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("completed emitter is dropped on the next publish")
    void dropsCompleted() {
        SseEmitter emitter = publisher.subscribe("100");
        emitter.complete();

        publisher.publish("100", new GifterUpdate("1", "alice", 5, 0));

        assertThat(publisher.subscriberCount("100")).isZero();
    }
}
