package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandKind;
import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.domain.Phase;
import com.phillippitts.petpal.exception.BusyException;
import com.phillippitts.petpal.util.MonotonicClock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe owner of the single-active-command invariant and of every command record mutation.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * idle      → executing   (accept)
 * executing → completed   (last phase succeeded)
 * executing → failed      (phase failure, low confidence after retries, adapter failure)
 * executing → timeout     (command or phase timeout)
 * executing → interrupted (accept of the preemptive kind)
 * </pre>
 *
 * <p>All transitions go through one {@link ReentrantLock}. Mutations are legal only while a
 * record is {@code executing}; a late mutation from an executor that has not yet noticed its
 * record was interrupted is rejected and reported as {@code false}.
 *
 * <p>The {@link CommandStatusListener} is invoked under the lock right after each mutation, which
 * fixes the order in which observers see the transitions of this instance.
 *
 * @since 1.0
 */
public final class CommandStateMachine {

    private static final Logger LOG = LogManager.getLogger(CommandStateMachine.class);

    private final Lock lock = new ReentrantLock();
    private final CommandStore store;
    private final long commandTimeoutMs;
    private final MonotonicClock clock;
    private final CommandStatusListener listener;

    private CommandRecord active;

    public CommandStateMachine(CommandStore store,
                               long commandTimeoutMs,
                               MonotonicClock clock,
                               CommandStatusListener listener) {
        this.store = Objects.requireNonNull(store, "store");
        this.commandTimeoutMs = commandTimeoutMs;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener != null ? listener : CommandStatusListener.NOOP;
    }

    /**
     * Result of a successful {@link #accept}.
     *
     * @param accepted  newly created executing record
     * @param preempted record interrupted by this acceptance, or {@code null}
     */
    public record Acceptance(CommandRecord accepted, CommandRecord preempted) {
    }

    /**
     * Accepts a command. Never blocks beyond the transition lock.
     *
     * @throws BusyException if a record is executing and {@code kind} is not preemptive
     */
    public Acceptance accept(CommandKind kind) {
        Objects.requireNonNull(kind, "kind");
        lock.lock();
        try {
            CommandRecord preempted = null;
            if (active != null && active.isExecuting()) {
                if (!kind.isPreemptive()) {
                    throw new BusyException(active.requestId());
                }
                preempted = active;
                preempted.terminate(CommandState.INTERRUPTED, "Interrupted by " + kind.prompt());
                LOG.info("Command {} interrupted by {}", preempted.requestId(), kind.prompt());
                notifyListener(preempted);
            }

            CommandRecord record = new CommandRecord(UUID.randomUUID().toString(), kind, commandTimeoutMs, clock);
            store.put(record);
            active = record;
            LOG.info("Command {} accepted: {}", record.requestId(), kind.prompt());
            notifyListener(record);
            return new Acceptance(record, preempted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an executing record into a phase.
     *
     * @return {@code false} if the record is no longer executing
     */
    public boolean enterPhase(CommandRecord record, Phase phase) {
        lock.lock();
        try {
            if (!record.isExecuting()) {
                return false;
            }
            record.enterPhase(phase);
            notifyListener(record);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the confidence of a detection attempt.
     *
     * @return {@code false} if the record is no longer executing
     */
    public boolean recordConfidence(CommandRecord record, double confidence, String message) {
        lock.lock();
        try {
            if (!record.isExecuting()) {
                return false;
            }
            record.recordConfidence(confidence, message);
            notifyListener(record);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a phase to the record's completed phases.
     *
     * @return {@code false} if the record is no longer executing
     */
    public boolean completePhase(CommandRecord record, Phase phase) {
        lock.lock();
        try {
            if (!record.isExecuting()) {
                return false;
            }
            record.completePhase(phase);
            notifyListener(record);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an executing record to a terminal state and releases the active slot.
     *
     * @return {@code false} if the record had already reached a terminal state
     * @throws IllegalArgumentException if {@code terminal} is not a terminal state
     */
    public boolean finish(CommandRecord record, CommandState terminal, String message) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        lock.lock();
        try {
            if (!record.isExecuting()) {
                return false;
            }
            record.terminate(terminal, message);
            if (active == record) {
                active = null;
            }
            LOG.info("Command {} finished: state={}, message={}", record.requestId(), terminal.wireName(), message);
            notifyListener(record);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the executing record, if any.
     */
    public Optional<CommandSnapshot> active() {
        lock.lock();
        try {
            return active == null ? Optional.empty() : Optional.of(active.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public boolean isIdle() {
        lock.lock();
        try {
            return active == null;
        } finally {
            lock.unlock();
        }
    }

    private void notifyListener(CommandRecord record) {
        CommandSnapshot snapshot = record.snapshot();
        try {
            listener.onTransition(snapshot);
        } catch (RuntimeException e) {
            LOG.warn("Status listener failed for {}: {}", snapshot.requestId(), e.getMessage());
        }
    }
}
