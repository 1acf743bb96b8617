package com.phillippitts.petpal.service.broadcast;

import java.time.Instant;

/**
 * Published when the shared bus rejects a publish and the hub falls back to local-only delivery.
 * Not surfaced to clients.
 */
public record BusFanoutDegradedEvent(String channel, Instant at, String reason) {
    public BusFanoutDegradedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
