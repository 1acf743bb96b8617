package com.phillippitts.petpal.service.capability;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Joint-space pose of the arm, one angle (radians) per joint.
 *
 * @param joints joint angles, in joint order
 */
public record ArmPose(List<Double> joints) {

    /** Number of joints on the arm. */
    public static final int JOINT_COUNT = 6;

    /** Safe resting pose: every joint at zero. */
    public static final ArmPose HOME = new ArmPose(List.of(0.0, 0.0, 0.0, 0.0, 0.0, 0.0));

    public ArmPose {
        Objects.requireNonNull(joints, "joints must not be null");
        if (joints.size() != JOINT_COUNT) {
            throw new IllegalArgumentException("Expected " + JOINT_COUNT + " joints, got: " + joints.size());
        }
        joints = List.copyOf(joints);
    }

    public static ArmPose of(double... angles) {
        List<Double> list = new ArrayList<>(angles.length);
        for (double a : angles) {
            list.add(a);
        }
        return new ArmPose(list);
    }

    public double joint(int index) {
        return joints.get(index);
    }

    /**
     * Largest absolute per-joint difference to another pose.
     */
    public double distanceTo(ArmPose other) {
        double max = 0.0;
        for (int i = 0; i < JOINT_COUNT; i++) {
            max = Math.max(max, Math.abs(joints.get(i) - other.joints.get(i)));
        }
        return max;
    }

    public boolean isWithin(ArmPose target, double tolerance) {
        return distanceTo(target) <= tolerance;
    }
}
