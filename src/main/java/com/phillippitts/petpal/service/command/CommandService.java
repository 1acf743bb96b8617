package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandKind;
import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.exception.BusyException;
import com.phillippitts.petpal.exception.InvalidCommandException;
import com.phillippitts.petpal.service.metrics.CommandMetrics;
import com.phillippitts.petpal.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for command submission and status lookup.
 *
 * <p>Resolves the prompt against the whitelist, routes the preemptive kind to the
 * {@link PreemptionController} and every other kind to the {@link CommandExecutor} on the command
 * pool. Submission returns as soon as the record is accepted.
 */
public final class CommandService {

    private static final Logger LOG = LogManager.getLogger(CommandService.class);
    private static final int MAX_LOGGED_PROMPT = 60;

    private final CommandStateMachine stateMachine;
    private final CommandStore store;
    private final CommandExecutor executor;
    private final PreemptionController preemption;
    private final Executor commandPool;
    private final CommandMetrics metrics;

    public CommandService(CommandStateMachine stateMachine,
                          CommandStore store,
                          CommandExecutor executor,
                          PreemptionController preemption,
                          Executor commandPool,
                          CommandMetrics metrics) {
        this.stateMachine = stateMachine;
        this.store = store;
        this.executor = executor;
        this.preemption = preemption;
        this.commandPool = commandPool;
        this.metrics = metrics;
    }

    /**
     * Accepts a command by prompt.
     *
     * @return snapshot of the accepted record (state {@code executing})
     * @throws InvalidCommandException if the prompt is not whitelisted
     * @throws BusyException           if another command is executing and the prompt is not preemptive
     */
    public CommandSnapshot submit(String prompt) {
        Optional<CommandKind> kind = CommandKind.fromPrompt(prompt);
        if (kind.isEmpty()) {
            incrementRejected("invalid");
            LOG.info("Rejected unknown prompt '{}'", LogSanitizer.truncate(prompt, MAX_LOGGED_PROMPT));
            throw new InvalidCommandException("unknown command '" + LogSanitizer.truncate(prompt, MAX_LOGGED_PROMPT)
                    + "'; allowed: " + CommandKind.allowedPrompts());
        }
        if (kind.get().isPreemptive()) {
            return preemption.preempt(kind.get());
        }

        CommandStateMachine.Acceptance acceptance;
        try {
            acceptance = stateMachine.accept(kind.get());
        } catch (BusyException e) {
            incrementRejected("busy");
            throw e;
        }

        CommandRecord record = acceptance.accepted();
        CommandSnapshot accepted = record.snapshot();
        try {
            commandPool.execute(() -> executor.execute(record));
        } catch (RejectedExecutionException e) {
            LOG.error("Could not schedule command {}", record.requestId(), e);
            stateMachine.finish(record, CommandState.FAILED, "Command executor unavailable");
            record.markStopped();
        }
        return accepted;
    }

    /**
     * Current snapshot of a record.
     *
     * @throws com.phillippitts.petpal.exception.CommandNotFoundException if unknown or evicted
     */
    public CommandSnapshot getStatus(String requestId) {
        return store.snapshot(requestId);
    }

    public Optional<CommandSnapshot> activeCommand() {
        return stateMachine.active();
    }

    private void incrementRejected(String reason) {
        if (metrics != null) {
            metrics.incrementRejected(reason);
        }
    }
}
