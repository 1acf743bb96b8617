package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.config.properties.CommandProperties;
import com.phillippitts.petpal.domain.CommandKind;
import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.exception.AdapterFailureException;
import com.phillippitts.petpal.exception.CapabilityTimeoutException;
import com.phillippitts.petpal.service.capability.ArmAdapter;
import com.phillippitts.petpal.service.capability.ArmPose;
import com.phillippitts.petpal.service.capability.ArmState;
import com.phillippitts.petpal.service.capability.CapabilityInvoker;
import com.phillippitts.petpal.util.Deadline;
import com.phillippitts.petpal.util.MonotonicClock;
import com.phillippitts.petpal.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Accepts the preemptive safe-state command at any time and runs it to completion.
 *
 * <p>Sequence:
 * <ol>
 *   <li>accept through the state machine, which marks the active record interrupted and sets its
 *       interrupt flag in the same transition</li>
 *   <li>wait at most one polling interval for the interrupted executor to stop</li>
 *   <li>issue the home motion directly, bounded by the safe-state deadline</li>
 *   <li>observe until the arm reports the home pose, still within the deadline</li>
 * </ol>
 *
 * <p>Missing the deadline ends the preempting record as {@code timeout}; an adapter failure ends it
 * as {@code failed}. Neither is thrown to the caller.
 */
public final class PreemptionController {

    private static final Logger LOG = LogManager.getLogger(PreemptionController.class);

    private final CommandStateMachine stateMachine;
    private final CommandProperties properties;
    private final ArmAdapter arm;
    private final CapabilityInvoker invoker;
    private final Executor safeStateExecutor;
    private final MonotonicClock clock;

    public PreemptionController(CommandStateMachine stateMachine,
                                CommandProperties properties,
                                ArmAdapter arm,
                                CapabilityInvoker invoker,
                                Executor safeStateExecutor,
                                MonotonicClock clock) {
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.arm = arm;
        this.invoker = invoker;
        this.safeStateExecutor = safeStateExecutor;
        this.clock = clock;
    }

    /**
     * Accepts the preemptive kind and schedules the safe-state motion.
     *
     * @return snapshot of the new record right after acceptance
     * @throws IllegalArgumentException if {@code kind} is not preemptive
     */
    public CommandSnapshot preempt(CommandKind kind) {
        if (!kind.isPreemptive()) {
            throw new IllegalArgumentException(kind + " is not preemptive");
        }
        CommandStateMachine.Acceptance acceptance = stateMachine.accept(kind);
        CommandRecord record = acceptance.accepted();
        CommandSnapshot accepted = record.snapshot();
        try {
            safeStateExecutor.execute(() -> runSafeState(acceptance));
        } catch (RejectedExecutionException e) {
            LOG.error("Could not schedule safe-state command {}", record.requestId(), e);
            stateMachine.finish(record, CommandState.FAILED, "Safe-state executor unavailable");
            record.markStopped();
        }
        return accepted;
    }

    void runSafeState(CommandStateMachine.Acceptance acceptance) {
        CommandRecord record = acceptance.accepted();
        ThreadContext.put("commandId", record.requestId());
        Deadline safeDeadline = Deadline.startingAt(record.startNanos(), properties.getSafeTimeoutMs(), clock);
        try {
            CommandRecord preempted = acceptance.preempted();
            if (preempted != null && !preempted.awaitStopped(properties.getPollIntervalMs())) {
                LOG.warn("Interrupted command {} still inside an adapter call; homing anyway",
                        preempted.requestId());
            }

            invoker.run("arm", "home", safeDeadline.remainingMillis(), arm::home);
            while (true) {
                if (record.isInterruptRequested() || !record.isExecuting()) {
                    stateMachine.finish(record, CommandState.INTERRUPTED, "Interrupted");
                    return;
                }
                if (safeDeadline.isExpired()) {
                    stateMachine.finish(record, CommandState.TIMEOUT,
                            "Safe state not reached within " + safeDeadline.budgetMillis() + "ms");
                    return;
                }
                ArmState state = invoker.call("arm", "observe", safeDeadline.remainingMillis(), arm::observe);
                if (state.pose().isWithin(ArmPose.HOME, properties.getPositionTolerance())) {
                    stateMachine.finish(record, CommandState.COMPLETED, "At home pose");
                    return;
                }
                if (!TimeUtils.sleepMillis(properties.getPollIntervalMs())) {
                    stateMachine.finish(record, CommandState.INTERRUPTED, "Executor thread interrupted");
                    return;
                }
            }
        } catch (CapabilityTimeoutException e) {
            stateMachine.finish(record, CommandState.TIMEOUT, "Safe state not reached: " + e.getMessage());
        } catch (AdapterFailureException e) {
            stateMachine.finish(record, CommandState.FAILED, "Safe state failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Safe-state command {} aborted by unexpected error", record.requestId(), e);
            stateMachine.finish(record, CommandState.FAILED, "Unexpected error: " + e.getMessage());
        } finally {
            record.markStopped();
            ThreadContext.remove("commandId");
        }
    }
}
