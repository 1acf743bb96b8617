package com.phillippitts.petpal.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics for notification fan-out.
 *
 * <p>{@code petpal.broadcast.published} is tagged with the notification type and its origin
 * ({@code local} or {@code bus}); {@code petpal.broadcast.pruned} counts subscribers dropped because
 * their queue was full or their connection failed.
 */
@Component
public class BroadcastMetrics {

    private final MeterRegistry registry;

    public BroadcastMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementPublished(String type, String origin) {
        Counter.builder("petpal.broadcast.published")
                .description("Notifications fanned out to local subscribers")
                .tag("type", type)
                .tag("origin", origin)
                .register(registry)
                .increment();
    }

    public void incrementPruned() {
        Counter.builder("petpal.broadcast.pruned")
                .description("Subscribers pruned as unreachable")
                .register(registry)
                .increment();
    }
}
