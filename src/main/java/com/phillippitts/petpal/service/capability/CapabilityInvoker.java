package com.phillippitts.petpal.service.capability;

import com.phillippitts.petpal.exception.AdapterFailureException;
import com.phillippitts.petpal.exception.CapabilityTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs capability adapter calls on a dedicated pool with a hard upper bound on how long the
 * caller waits.
 *
 * <p>The control loop of a command must never block on a hung adapter beyond its phase timeout.
 * Every call is therefore submitted as a {@link FutureTask}; the caller waits at most
 * {@code timeoutMs}, then cancels the task with interruption and raises
 * {@link CapabilityTimeoutException}. Whether the adapter actually stops is up to the adapter.
 *
 * <p>Any exception raised by the adapter is wrapped in {@link AdapterFailureException} carrying the
 * adapter's message. Both failure kinds publish an {@link AdapterFailureEvent}.
 *
 * <p><b>Thread Safety:</b> stateless apart from its collaborators; safe for concurrent use.
 *
 * @since 1.0
 */
public final class CapabilityInvoker {

    private static final Logger LOG = LogManager.getLogger(CapabilityInvoker.class);

    private final Executor executor;
    private final ApplicationEventPublisher publisher;

    /**
     * @param executor  pool that runs adapter calls
     * @param publisher event publisher for failure notifications (nullable)
     */
    public CapabilityInvoker(Executor executor, ApplicationEventPublisher publisher) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = publisher;
    }

    /**
     * Calls an adapter and returns its result.
     *
     * @param capability capability name for messages and events (e.g. {@code arm})
     * @param operation  operation name (e.g. {@code observe})
     * @param timeoutMs  maximum wait; values below 1 are raised to 1
     * @param call       adapter call
     * @throws CapabilityTimeoutException if the call does not return in time
     * @throws AdapterFailureException    if the call raises or cannot be scheduled
     */
    public <T> T call(String capability, String operation, long timeoutMs, Callable<T> call) {
        long bound = Math.max(1L, timeoutMs);
        FutureTask<T> task = new FutureTask<>(call);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            publishFailure(capability, operation, "rejected", "capability pool saturated");
            throw new AdapterFailureException(capability, operation + " could not be scheduled", e);
        }

        try {
            return task.get(bound, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            LOG.warn("Capability call timed out: {}.{} after {}ms", capability, operation, bound);
            publishFailure(capability, operation, "timeout", "no result within " + bound + "ms");
            throw new CapabilityTimeoutException(capability, operation, bound);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AdapterFailureException afe) {
                publishFailure(capability, operation, "adapter-error", afe.getMessage());
                throw afe;
            }
            String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            publishFailure(capability, operation, "adapter-error", detail);
            throw new AdapterFailureException(capability, operation + " failed: " + detail, cause);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new AdapterFailureException(capability, operation + " interrupted while waiting", e);
        }
    }

    /**
     * Variant of {@link #call} for adapter operations without a result.
     */
    public void run(String capability, String operation, long timeoutMs, Runnable call) {
        call(capability, operation, timeoutMs, () -> {
            call.run();
            return null;
        });
    }

    private void publishFailure(String capability, String operation, String reason, String message) {
        if (publisher == null) {
            return;
        }
        Map<String, String> context = new HashMap<>();
        context.put("reason", reason);
        publisher.publishEvent(new AdapterFailureEvent(capability, operation, Instant.now(), message, context));
    }
}
