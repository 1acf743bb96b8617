package com.phillippitts.petpal.domain;

import java.util.Locale;

/**
 * Named step within a multi-step command.
 *
 * <p>{@link #DETECT} is detection-bearing (gated on detector confidence). {@link #THROW} is a
 * hand-off to the arm's scripted throw, run only when the arm is ready and the workspace is clear,
 * and done when the arm comes to rest. Every other phase is an actuation phase that completes when
 * the arm reports its target pose reached.
 */
public enum Phase {

    DETECT,
    APPROACH,
    GRASP,
    LIFT,
    DROP,
    READY_TO_THROW,
    THROW,
    HOME;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isDetection() {
        return this == DETECT;
    }

    public boolean isHandoff() {
        return this == THROW;
    }
}
