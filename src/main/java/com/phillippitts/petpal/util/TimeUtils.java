package com.phillippitts.petpal.util;

/**
 * Utility methods for time conversions and elapsed time calculations against a
 * {@link MonotonicClock}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp taken from the same clock.
     *
     * @param clock      monotonic clock
     * @param startNanos start time from {@code clock.nanoTime()}
     * @return elapsed milliseconds, never negative
     */
    public static long elapsedMillis(MonotonicClock clock, long startNanos) {
        return Math.max(0L, nanosToMillis(clock.nanoTime() - startNanos));
    }

    /**
     * Sleeps for the given duration, restoring the interrupt flag if woken early.
     *
     * @return {@code false} if the thread was interrupted while sleeping
     */
    public static boolean sleepMillis(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
