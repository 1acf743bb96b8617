package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandKind;
import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.domain.Phase;
import com.phillippitts.petpal.util.MonotonicClock;
import com.phillippitts.petpal.util.TimeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Mutable record of one accepted command.
 *
 * <p>Lifecycle fields are mutated only through {@link CommandStateMachine}; the interrupt flag and
 * the stopped latch are the two hand-off points between the state machine and the thread that
 * executes the command.
 */
public final class CommandRecord {

    private final String requestId;
    private final CommandKind kind;
    private final long startNanos;
    private final long timeoutMs;
    private final MonotonicClock clock;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean interruptRequested;

    // guarded by this
    private CommandState state = CommandState.EXECUTING;
    private Phase phase;
    private Double confidence;
    private String message;
    private long endNanos = -1;
    private final List<Phase> completedPhases = new ArrayList<>();

    CommandRecord(String requestId, CommandKind kind, long timeoutMs, MonotonicClock clock) {
        this.requestId = requestId;
        this.kind = kind;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
        this.startNanos = clock.nanoTime();
        this.phase = PhasePlan.initialPhase(kind);
        this.message = "Accepted: " + kind.prompt();
    }

    public String requestId() {
        return requestId;
    }

    public CommandKind kind() {
        return kind;
    }

    public long startNanos() {
        return startNanos;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public boolean isInterruptRequested() {
        return interruptRequested;
    }

    public synchronized CommandState state() {
        return state;
    }

    public synchronized boolean isExecuting() {
        return state == CommandState.EXECUTING;
    }

    /**
     * Signals that the executing thread has stopped issuing adapter calls for this record.
     */
    void markStopped() {
        stopped.countDown();
    }

    /**
     * Waits for the executing thread to stop.
     *
     * @return {@code true} if it stopped within the wait
     */
    boolean awaitStopped(long timeoutMs) {
        try {
            return stopped.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Mutators below are called by CommandStateMachine under its lock.

    synchronized void enterPhase(Phase next) {
        this.phase = next;
        this.message = "Phase " + next.wireName();
    }

    synchronized void recordConfidence(double value, String note) {
        this.confidence = value;
        this.message = note;
    }

    synchronized void completePhase(Phase done) {
        completedPhases.add(done);
    }

    synchronized void terminate(CommandState terminal, String note) {
        this.state = terminal;
        this.message = note;
        this.endNanos = clock.nanoTime();
        if (terminal == CommandState.INTERRUPTED) {
            this.interruptRequested = true;
        }
    }

    public synchronized CommandSnapshot snapshot() {
        long reference = endNanos >= 0 ? endNanos : clock.nanoTime();
        long elapsedMs = Math.max(0L, TimeUtils.nanosToMillis(reference - startNanos));
        List<String> phases = new ArrayList<>(completedPhases.size());
        for (Phase p : completedPhases) {
            phases.add(p.wireName());
        }
        return new CommandSnapshot(requestId, kind.prompt(), state,
                phase == null ? null : phase.wireName(), confidence, message, elapsedMs, phases);
    }
}
