package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.config.properties.CommandProperties;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.domain.Detection;
import com.phillippitts.petpal.domain.Phase;
import com.phillippitts.petpal.exception.AdapterFailureException;
import com.phillippitts.petpal.exception.CapabilityTimeoutException;
import com.phillippitts.petpal.service.capability.ArmAdapter;
import com.phillippitts.petpal.service.capability.ArmState;
import com.phillippitts.petpal.service.capability.CameraAdapter;
import com.phillippitts.petpal.service.capability.CameraFrame;
import com.phillippitts.petpal.service.capability.CapabilityInvoker;
import com.phillippitts.petpal.service.capability.DetectorAdapter;
import com.phillippitts.petpal.service.capability.SafetyValidator;
import com.phillippitts.petpal.service.capability.WorkspaceMonitor;
import com.phillippitts.petpal.service.metrics.CommandMetrics;
import com.phillippitts.petpal.util.Deadline;
import com.phillippitts.petpal.util.MonotonicClock;
import com.phillippitts.petpal.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Drives an accepted command through its phases.
 *
 * <p>Runs on its own thread per command. Between phases and on every control-loop tick it checks the
 * record's interrupt flag, the overall command deadline and the phase deadline; every adapter call
 * is bounded by the earlier of the two deadlines through {@link CapabilityInvoker}, so a hung
 * adapter cannot hold the loop past the phase timeout.
 *
 * <p>Phase handling:
 * <ul>
 *   <li>Detection: capture a frame, run the detector, record the confidence. Below the threshold the
 *       attempt is retried up to the retry limit, then the command fails.</li>
 *   <li>Actuation: validate the target against joint limits, issue the motion, then observe on the
 *       polling cadence until the pose is within tolerance.</li>
 *   <li>Hand-off (throw): runs only if the observed elbow angle is within the throw-ready bound and
 *       the workspace is clear, then observes until the arm is at rest. A blocked hand-off is
 *       skipped, not failed; the completion message names the reason.</li>
 * </ul>
 *
 * <p>Adapter timeouts end the command as {@code timeout}; any other adapter failure ends it as
 * {@code failed} with the adapter's detail.
 *
 * @since 1.0
 */
public final class CommandExecutor {

    private static final Logger LOG = LogManager.getLogger(CommandExecutor.class);

    private final CommandStateMachine stateMachine;
    private final CommandProperties properties;
    private final ArmAdapter arm;
    private final CameraAdapter camera;
    private final DetectorAdapter detector;
    private final WorkspaceMonitor workspace;
    private final SafetyValidator safety;
    private final CapabilityInvoker invoker;
    private final MonotonicClock clock;
    private final CommandMetrics metrics;

    public CommandExecutor(CommandStateMachine stateMachine,
                           CommandProperties properties,
                           ArmAdapter arm,
                           CameraAdapter camera,
                           DetectorAdapter detector,
                           WorkspaceMonitor workspace,
                           SafetyValidator safety,
                           CapabilityInvoker invoker,
                           MonotonicClock clock,
                           CommandMetrics metrics) {
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.arm = arm;
        this.camera = camera;
        this.detector = detector;
        this.workspace = workspace;
        this.safety = safety;
        this.invoker = invoker;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Executes the record's phase plan to a terminal state. Never throws.
     */
    public void execute(CommandRecord record) {
        ThreadContext.put("commandId", record.requestId());
        try {
            runPlan(record);
        } catch (RuntimeException e) {
            LOG.error("Command {} aborted by unexpected error", record.requestId(), e);
            stateMachine.finish(record, CommandState.FAILED, "Unexpected error: " + e.getMessage());
        } finally {
            record.markStopped();
            ThreadContext.remove("commandId");
        }
    }

    private void runPlan(CommandRecord record) {
        Deadline overall = Deadline.startingAt(record.startNanos(), record.timeoutMs(), clock);
        List<PhaseStep> steps = PhasePlan.forKind(record.kind());
        String skipped = null;

        for (PhaseStep step : steps) {
            if (shouldStop(record, overall)) {
                return;
            }
            Phase phase = step.phase();
            long phaseTimeoutMs = properties.phaseTimeoutMs(phase);
            Deadline phaseDeadline = Deadline.after(phaseTimeoutMs, clock);

            boolean done;
            try {
                if (phase.isHandoff()) {
                    Optional<String> blocked = handoffBlocker(overall, phaseDeadline);
                    if (blocked.isPresent()) {
                        LOG.info("Skipping {} for {}: {}", phase.wireName(), record.requestId(), blocked.get());
                        skipped = phase.wireName() + " skipped: " + blocked.get();
                        continue;
                    }
                }
                if (!stateMachine.enterPhase(record, phase)) {
                    return;
                }
                LOG.debug("Entered phase {} (timeout={}ms)", phase.wireName(), phaseTimeoutMs);
                if (phase.isDetection()) {
                    done = runDetection(record, step, overall, phaseDeadline);
                } else if (phase.isHandoff()) {
                    done = runHandoff(record, step, overall, phaseDeadline);
                } else {
                    done = runActuation(record, step, overall, phaseDeadline);
                }
            } catch (CapabilityTimeoutException e) {
                stateMachine.finish(record, CommandState.TIMEOUT,
                        "Phase " + phase.wireName() + " timed out: " + e.getMessage());
                return;
            } catch (AdapterFailureException e) {
                stateMachine.finish(record, CommandState.FAILED,
                        "Phase " + phase.wireName() + " failed: " + e.getMessage());
                return;
            }
            if (!done) {
                return;
            }
            if (!stateMachine.completePhase(record, phase)) {
                return;
            }
            if (metrics != null) {
                metrics.recordPhase(phase.wireName(), phaseDeadline.elapsedMillis());
            }
        }

        if (!shouldStop(record, overall)) {
            String message = "Completed: " + record.kind().prompt();
            stateMachine.finish(record, CommandState.COMPLETED,
                    skipped == null ? message : message + " (" + skipped + ")");
        }
    }

    private boolean runDetection(CommandRecord record, PhaseStep step, Deadline overall, Deadline phaseDeadline) {
        int attempts = properties.getDetectionRetryLimit() + 1;
        double threshold = properties.getConfidenceThreshold();
        String label = step.detectLabel();
        double lastConfidence = 0.0;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1 && (shouldStop(record, overall) || phaseExpired(record, step, phaseDeadline))) {
                return false;
            }
            CameraFrame frame = invoker.call("camera", "captureFrame",
                    bound(overall, phaseDeadline), camera::captureFrame);
            Detection detection = invoker.call("detector", "detect",
                    bound(overall, phaseDeadline), () -> detector.detect(frame, label));
            lastConfidence = detection.confidence();

            String note = String.format(Locale.ROOT, "Detected %s with confidence %.2f (attempt %d/%d)",
                    label, lastConfidence, attempt, attempts);
            if (!stateMachine.recordConfidence(record, lastConfidence, note)) {
                return false;
            }
            if (lastConfidence >= threshold) {
                return true;
            }
            LOG.debug("Low confidence for {}: {} < {}", label, lastConfidence, threshold);
        }

        stateMachine.finish(record, CommandState.FAILED, String.format(Locale.ROOT,
                "Could not detect %s: confidence %.2f below threshold %.2f after %d attempts",
                label, lastConfidence, threshold, attempts));
        return false;
    }

    private boolean runActuation(CommandRecord record, PhaseStep step, Deadline overall, Deadline phaseDeadline) {
        Optional<String> violation = safety.check(step.target());
        if (violation.isPresent()) {
            stateMachine.finish(record, CommandState.FAILED, violation.get());
            return false;
        }

        invoker.run("arm", "actuate", bound(overall, phaseDeadline), () -> arm.actuate(step.target()));

        while (true) {
            if (shouldStop(record, overall) || phaseExpired(record, step, phaseDeadline)) {
                return false;
            }
            ArmState state = invoker.call("arm", "observe", bound(overall, phaseDeadline), arm::observe);
            if (state.pose().isWithin(step.target(), properties.getPositionTolerance())) {
                return true;
            }
            if (!TimeUtils.sleepMillis(properties.getPollIntervalMs())) {
                stateMachine.finish(record, CommandState.INTERRUPTED, "Executor thread interrupted");
                return false;
            }
        }
    }

    private Optional<String> handoffBlocker(Deadline overall, Deadline phaseDeadline) {
        ArmState state = invoker.call("arm", "observe", bound(overall, phaseDeadline), arm::observe);
        Optional<String> notReady = safety.checkThrowReady(state.pose());
        if (notReady.isPresent()) {
            return notReady;
        }
        boolean clear = invoker.call("workspace", "isClear", bound(overall, phaseDeadline), workspace::isClear);
        return clear ? Optional.empty() : Optional.of("workspace not clear");
    }

    private boolean runHandoff(CommandRecord record, PhaseStep step, Deadline overall, Deadline phaseDeadline) {
        invoker.run("arm", "throwMacro", bound(overall, phaseDeadline), arm::throwMacro);

        while (true) {
            if (shouldStop(record, overall) || phaseExpired(record, step, phaseDeadline)) {
                return false;
            }
            ArmState state = invoker.call("arm", "observe", bound(overall, phaseDeadline), arm::observe);
            if (!state.moving()) {
                return true;
            }
            if (!TimeUtils.sleepMillis(properties.getPollIntervalMs())) {
                stateMachine.finish(record, CommandState.INTERRUPTED, "Executor thread interrupted");
                return false;
            }
        }
    }

    /**
     * Checks the interrupt flag and the overall deadline, recording the terminal state if either
     * tripped.
     */
    private boolean shouldStop(CommandRecord record, Deadline overall) {
        if (record.isInterruptRequested() || !record.isExecuting()) {
            stateMachine.finish(record, CommandState.INTERRUPTED, "Interrupted");
            return true;
        }
        if (overall.isExpired()) {
            stateMachine.finish(record, CommandState.TIMEOUT,
                    "Command exceeded its " + overall.budgetMillis() + "ms timeout");
            return true;
        }
        return false;
    }

    private boolean phaseExpired(CommandRecord record, PhaseStep step, Deadline phaseDeadline) {
        if (phaseDeadline.isExpired()) {
            stateMachine.finish(record, CommandState.TIMEOUT, "Phase " + step.phase().wireName()
                    + " did not complete within " + phaseDeadline.budgetMillis() + "ms");
            return true;
        }
        return false;
    }

    private static long bound(Deadline overall, Deadline phaseDeadline) {
        return Deadline.earliest(overall, phaseDeadline).remainingMillis();
    }
}
