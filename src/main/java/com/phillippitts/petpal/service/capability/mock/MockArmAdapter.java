package com.phillippitts.petpal.service.capability.mock;

import com.phillippitts.petpal.service.capability.ArmAdapter;
import com.phillippitts.petpal.service.capability.ArmPose;
import com.phillippitts.petpal.service.capability.ArmState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Simulated arm. Every {@link #observe()} moves each joint up to {@code stepRad} toward the last
 * target, so a phase completes after a handful of control-loop ticks. {@link #home()} snaps to the
 * home pose immediately. {@link #throwMacro()} swings the shoulder back by {@value #THROW_SHOULDER_RAD}
 * rad and the elbow forward by {@value #THROW_ELBOW_RAD} rad from the current pose.
 */
public class MockArmAdapter implements ArmAdapter {

    private static final Logger LOG = LogManager.getLogger(MockArmAdapter.class);

    static final double THROW_SHOULDER_RAD = -0.5;
    static final double THROW_ELBOW_RAD = 1.0;

    private final double stepRad;
    private ArmPose current = ArmPose.HOME;
    private ArmPose target = ArmPose.HOME;

    public MockArmAdapter(double stepRad) {
        if (stepRad <= 0) {
            throw new IllegalArgumentException("stepRad must be > 0, got: " + stepRad);
        }
        this.stepRad = stepRad;
    }

    @Override
    public synchronized void home() {
        LOG.debug("Mock arm homing from {}", current.joints());
        current = ArmPose.HOME;
        target = ArmPose.HOME;
    }

    @Override
    public synchronized void actuate(ArmPose target) {
        LOG.debug("Mock arm moving to {}", target.joints());
        this.target = target;
    }

    @Override
    public synchronized void throwMacro() {
        List<Double> release = new ArrayList<>(current.joints());
        release.set(1, release.get(1) + THROW_SHOULDER_RAD);
        release.set(2, release.get(2) + THROW_ELBOW_RAD);
        LOG.debug("Mock arm throwing from {}", current.joints());
        target = new ArmPose(release);
    }

    @Override
    public synchronized ArmState observe() {
        List<Double> next = new ArrayList<>(ArmPose.JOINT_COUNT);
        for (int i = 0; i < ArmPose.JOINT_COUNT; i++) {
            double delta = target.joint(i) - current.joint(i);
            double step = Math.max(-stepRad, Math.min(stepRad, delta));
            next.add(current.joint(i) + step);
        }
        current = new ArmPose(next);
        return new ArmState(current, current.distanceTo(target) > 0.0);
    }
}
