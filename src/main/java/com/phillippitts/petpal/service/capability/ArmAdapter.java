package com.phillippitts.petpal.service.capability;

/**
 * Actuator capability of the robot arm.
 *
 * <p>Implementations may block. Callers bound every call through {@link CapabilityInvoker}, so an
 * implementation that reacts to thread interruption aborts promptly when a call is cancelled.
 */
public interface ArmAdapter {

    /**
     * Starts a bounded, path-planning-free motion to {@link ArmPose#HOME}.
     */
    void home();

    /**
     * Starts a motion toward the target. Returns once the motion has been issued, not when it
     * finishes; completion is observed through {@link #observe()}.
     */
    void actuate(ArmPose target);

    /**
     * Starts the scripted throw from the current pose. Returns once the motion has been issued; the
     * throw is over when {@link #observe()} reports the arm at rest.
     */
    void throwMacro();

    ArmState observe();
}
