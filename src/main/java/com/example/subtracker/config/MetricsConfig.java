package com.example.subtracker.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter webhookNotificationsTotal(MeterRegistry registry) {
        return Counter.builder("webhook_notifications_total")
                .description("Total number of gift notifications written to a ledger")
                .register(registry);
    }

    @Bean
    public Counter webhookRejectedTotal(MeterRegistry registry) {
        return Counter.builder("webhook_rejected_total")
                .description("Total number of webhook deliveries rejected for a bad signature")
                .register(registry);
    }

    @Bean
    public Counter webhookMalformedTotal(MeterRegistry registry) {
        return Counter.builder("webhook_malformed_total")
                .description("Total number of acknowledged webhook deliveries with an unrecognized payload")
                .register(registry);
    }

    @Bean
    public Counter ledgersProvisionedTotal(MeterRegistry registry) {
        return Counter.builder("ledgers_provisioned_total")
                .description("Total number of tenant ledgers created")
                .register(registry);
    }

    @Bean
    public Counter liveUpdateFailuresTotal(MeterRegistry registry) {
        return Counter.builder("live_update_failures_total")
                .description("Total number of live updates that could not be delivered")
                .register(registry);
    }
}
