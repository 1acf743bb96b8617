package com.phillippitts.petpal.util;

/**
 * Source of monotonic time in nanoseconds. Injected wherever elapsed time decides an outcome
 * so tests can drive time explicitly.
 */
@FunctionalInterface
public interface MonotonicClock {

    MonotonicClock SYSTEM = System::nanoTime;

    long nanoTime();
}
