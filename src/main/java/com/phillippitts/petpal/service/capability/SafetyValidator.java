package com.phillippitts.petpal.service.capability;

import java.util.Locale;
import java.util.Optional;

/**
 * Checks arm targets against symmetric per-joint limits before any actuation is issued, and the arm
 * pose before the scripted throw.
 */
public final class SafetyValidator {

    /** Joint whose angle decides whether the arm is in throwing position (elbow). */
    static final int THROW_JOINT = 2;

    /** Default bound on {@link #THROW_JOINT} for the throw to start. */
    public static final double DEFAULT_THROW_READY_RAD = 0.25;

    private final double jointLimitRad;
    private final double throwReadyRad;

    public SafetyValidator(double jointLimitRad) {
        this(jointLimitRad, DEFAULT_THROW_READY_RAD);
    }

    public SafetyValidator(double jointLimitRad, double throwReadyRad) {
        if (jointLimitRad <= 0) {
            throw new IllegalArgumentException("jointLimitRad must be > 0, got: " + jointLimitRad);
        }
        if (throwReadyRad <= 0) {
            throw new IllegalArgumentException("throwReadyRad must be > 0, got: " + throwReadyRad);
        }
        this.jointLimitRad = jointLimitRad;
        this.throwReadyRad = throwReadyRad;
    }

    /**
     * Validates a target pose.
     *
     * @return description of the first violation, or empty if the pose is within limits
     */
    public Optional<String> check(ArmPose target) {
        for (int i = 0; i < ArmPose.JOINT_COUNT; i++) {
            double angle = target.joint(i);
            if (Double.isNaN(angle) || Math.abs(angle) > jointLimitRad) {
                return Optional.of(String.format(Locale.ROOT,
                        "safety check failed: joint %d target %.3f outside ±%.2f rad", i, angle, jointLimitRad));
            }
        }
        return Optional.empty();
    }

    /**
     * Checks that the observed pose is a valid starting point for the throw.
     *
     * @return why the throw must not start, or empty if the arm is ready
     */
    public Optional<String> checkThrowReady(ArmPose current) {
        double elbow = current.joint(THROW_JOINT);
        if (Double.isNaN(elbow) || Math.abs(elbow) >= throwReadyRad) {
            return Optional.of(String.format(Locale.ROOT,
                    "arm not ready to throw: joint %d at %.3f, needs to be within ±%.2f rad",
                    THROW_JOINT, elbow, throwReadyRad));
        }
        return Optional.empty();
    }

    public double getJointLimitRad() {
        return jointLimitRad;
    }
}
