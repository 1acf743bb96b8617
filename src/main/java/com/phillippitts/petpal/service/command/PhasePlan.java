package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandKind;
import com.phillippitts.petpal.domain.Phase;

import java.util.List;

/**
 * Ordered phase sequences per command kind, with the joint targets of each actuation phase.
 *
 * <p>The throw that ends {@link CommandKind#PICK_UP_BALL} is guarded: {@link CommandExecutor} skips
 * it when the arm is not ready to throw or the workspace is not clear.
 *
 * <p>{@link CommandKind#GO_HOME} has no plan: it is a single bounded home motion run by the
 * {@link PreemptionController}.
 */
public final class PhasePlan {

    private static final List<PhaseStep> PICK_UP_BALL = List.of(
            PhaseStep.detect("ball"),
            PhaseStep.move(Phase.APPROACH, 0.1, 0.2, 0.0, 0.0, 0.0, 0.0),
            PhaseStep.move(Phase.GRASP, 0.2, 0.3, 0.0, 0.1, 0.0, 0.0),
            PhaseStep.move(Phase.LIFT, 0.2, 0.2, 0.1, 0.1, 0.0, 0.0),
            PhaseStep.move(Phase.READY_TO_THROW, 0.2, 0.2, 0.2, 0.1, 0.0, 0.0),
            PhaseStep.handoff(Phase.THROW));

    private static final List<PhaseStep> GET_TREAT = List.of(
            PhaseStep.detect("treat"),
            PhaseStep.move(Phase.APPROACH, 0.2, 0.1, 0.0, 0.1, 0.0, 0.0),
            PhaseStep.move(Phase.GRASP, 0.3, 0.1, 0.0, 0.1, 0.0, 0.0),
            PhaseStep.move(Phase.LIFT, 0.2, 0.2, 0.0, 0.1, 0.0, 0.0),
            PhaseStep.move(Phase.DROP, 0.1, 0.2, 0.0, 0.1, 0.0, 0.0));

    private PhasePlan() {
    }

    /**
     * Returns the steps for a kind, in execution order; empty for phase-less kinds.
     */
    public static List<PhaseStep> forKind(CommandKind kind) {
        switch (kind) {
            case PICK_UP_BALL:
                return PICK_UP_BALL;
            case GET_TREAT:
                return GET_TREAT;
            default:
                return List.of();
        }
    }

    /**
     * Phase the record shows right after acceptance, or {@code null} for phase-less kinds.
     */
    public static Phase initialPhase(CommandKind kind) {
        List<PhaseStep> steps = forKind(kind);
        return steps.isEmpty() ? null : steps.get(0).phase();
    }
}
