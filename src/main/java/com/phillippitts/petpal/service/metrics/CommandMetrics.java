package com.phillippitts.petpal.service.metrics;

import com.phillippitts.petpal.domain.CommandSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for command orchestration.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Terminal outcomes per command kind and state</li>
 *   <li>Command duration from acceptance to terminal state</li>
 *   <li>Rejected submissions (busy, invalid)</li>
 *   <li>Per-phase duration</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class CommandMetrics {

    private static final String METRIC_PREFIX = "petpal";

    private final MeterRegistry registry;

    public CommandMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a terminal snapshot. Non-terminal snapshots are ignored.
     */
    public void recordOutcome(CommandSnapshot snapshot) {
        if (!snapshot.isTerminal()) {
            return;
        }
        String state = snapshot.state().wireName();
        Counter.builder(METRIC_PREFIX + ".command.outcome")
                .description("Number of commands by terminal state")
                .tag("kind", snapshot.kind())
                .tag("state", state)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".command.duration")
                .description("Time from acceptance to terminal state")
                .tag("kind", snapshot.kind())
                .tag("state", state)
                .register(registry)
                .record(snapshot.elapsedMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Increments the rejected-submission counter.
     *
     * @param reason rejection reason (busy, invalid)
     */
    public void incrementRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".command.rejected")
                .description("Number of rejected command submissions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a successfully completed phase took.
     */
    public void recordPhase(String phase, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".phase.duration")
                .description("Time spent in a command phase")
                .tag("phase", phase)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
