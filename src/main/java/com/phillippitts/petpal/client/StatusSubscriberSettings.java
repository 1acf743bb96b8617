package com.phillippitts.petpal.client;

/**
 * Reconnect and polling settings of a {@link StatusSubscriber}.
 *
 * @param baseDelayMs        delay before the first reconnection attempt
 * @param multiplier         growth factor between attempts
 * @param maxDelayMs         cap on the un-jittered delay
 * @param jitterRatio        additive jitter as a fraction of the delay, in [0,1]
 * @param maxReconnectAttempts failed reconnection attempts before switching to polling
 * @param pollIntervalMs     status endpoint polling interval
 * @param connectTimeoutMs   bound on establishing the push stream
 */
public record StatusSubscriberSettings(
        long baseDelayMs,
        double multiplier,
        long maxDelayMs,
        double jitterRatio,
        int maxReconnectAttempts,
        long pollIntervalMs,
        long connectTimeoutMs
) {

    public StatusSubscriberSettings {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Require 0 < baseDelayMs <= maxDelayMs, got "
                    + baseDelayMs + "/" + maxDelayMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be between 0.0 and 1.0, got: " + jitterRatio);
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0, got: " + maxReconnectAttempts);
        }
        if (pollIntervalMs <= 0 || connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs and connectTimeoutMs must be positive");
        }
    }

    public static StatusSubscriberSettings defaults() {
        return new StatusSubscriberSettings(500, 2.0, 8000, 0.2, 3, 500, 5000);
    }
}
