package com.phillippitts.petpal.util;

import java.util.Objects;

/**
 * Point in monotonic time after which an operation is considered late.
 *
 * <p>Used for both the overall command timeout and the per-phase timeout; the executor checks the
 * two independently and bounds every adapter call by the earlier one.
 *
 * @since 1.0
 */
public final class Deadline {

    private final MonotonicClock clock;
    private final long startNanos;
    private final long budgetMs;

    private Deadline(MonotonicClock clock, long startNanos, long budgetMs) {
        this.clock = clock;
        this.startNanos = startNanos;
        this.budgetMs = budgetMs;
    }

    /**
     * Creates a deadline {@code budgetMs} from now.
     *
     * @throws IllegalArgumentException if budgetMs is negative
     */
    public static Deadline after(long budgetMs, MonotonicClock clock) {
        if (budgetMs < 0) {
            throw new IllegalArgumentException("budgetMs must be >= 0, got: " + budgetMs);
        }
        Objects.requireNonNull(clock, "clock");
        return new Deadline(clock, clock.nanoTime(), budgetMs);
    }

    /**
     * Creates a deadline measured from an earlier start instant of the same clock.
     */
    public static Deadline startingAt(long startNanos, long budgetMs, MonotonicClock clock) {
        Objects.requireNonNull(clock, "clock");
        return new Deadline(clock, startNanos, budgetMs);
    }

    public boolean isExpired() {
        return elapsedMillis() > budgetMs;
    }

    public long elapsedMillis() {
        return TimeUtils.elapsedMillis(clock, startNanos);
    }

    public long remainingMillis() {
        return Math.max(0L, budgetMs - elapsedMillis());
    }

    public long budgetMillis() {
        return budgetMs;
    }

    /** Returns whichever of the two deadlines leaves less time. */
    public static Deadline earliest(Deadline a, Deadline b) {
        return a.remainingMillis() <= b.remainingMillis() ? a : b;
    }
}
