package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.Phase;
import com.phillippitts.petpal.service.capability.ArmPose;

import java.util.Objects;

/**
 * One planned step of a command.
 *
 * @param phase       phase entered by this step
 * @param target      arm target for actuation phases, null for detection and hand-off
 * @param detectLabel label to look for in detection phases, null for actuation
 */
public record PhaseStep(Phase phase, ArmPose target, String detectLabel) {

    public PhaseStep {
        Objects.requireNonNull(phase, "phase must not be null");
        if (phase.isDetection() && detectLabel == null) {
            throw new IllegalArgumentException("Detection step requires a label");
        }
        if (!phase.isDetection() && !phase.isHandoff() && target == null) {
            throw new IllegalArgumentException("Actuation step " + phase.wireName() + " requires a target pose");
        }
    }

    static PhaseStep detect(String label) {
        return new PhaseStep(Phase.DETECT, null, label);
    }

    static PhaseStep handoff(Phase phase) {
        return new PhaseStep(phase, null, null);
    }

    static PhaseStep move(Phase phase, double... joints) {
        return new PhaseStep(phase, ArmPose.of(joints), null);
    }
}
