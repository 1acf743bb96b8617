package com.phillippitts.petpal.client;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with additive jitter.
 *
 * <p>The un-jittered delay of attempt {@code n} (0-based) is {@code min(base × multiplier^n, max)};
 * jitter adds up to {@code jitterRatio} of that delay so clients that lost the same stream do not
 * reconnect in lockstep.
 */
public final class BackoffPolicy {

    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public BackoffPolicy(StatusSubscriberSettings settings) {
        this(settings, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0,1)
     */
    public BackoffPolicy(StatusSubscriberSettings settings, DoubleSupplier random) {
        this.baseDelayMs = settings.baseDelayMs();
        this.multiplier = settings.multiplier();
        this.maxDelayMs = settings.maxDelayMs();
        this.jitterRatio = settings.jitterRatio();
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Delay before reconnection attempt {@code attempt} (0-based), without jitter.
     */
    public long baseDelayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
        }
        double delay = baseDelayMs * Math.pow(multiplier, attempt);
        return (long) Math.min(delay, maxDelayMs);
    }

    /**
     * Delay before reconnection attempt {@code attempt} (0-based), jitter included.
     */
    public long delayFor(int attempt) {
        long base = baseDelayFor(attempt);
        return base + (long) (base * jitterRatio * random.getAsDouble());
    }
}
