package com.phillippitts.petpal.service.capability;

import java.util.Objects;

/**
 * Observed arm state.
 *
 * @param pose   current joint pose
 * @param moving whether the arm is still travelling toward its last target
 */
public record ArmState(ArmPose pose, boolean moving) {

    public ArmState {
        Objects.requireNonNull(pose, "pose must not be null");
    }
}
