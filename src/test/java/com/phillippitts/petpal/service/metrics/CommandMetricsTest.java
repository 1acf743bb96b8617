package com.phillippitts.petpal.service.metrics;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CommandMetricsTest {

    private MeterRegistry registry;
    private CommandMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CommandMetrics(registry);
    }

    private static CommandSnapshot snapshot(CommandState state, long elapsedMs) {
        return new CommandSnapshot("req-1", "pick up the ball", state, "lift", 0.9, "msg", elapsedMs,
                List.of("detect", "approach"));
    }

    @Test
    void shouldRecordTerminalOutcomeAndDuration() {
        metrics.recordOutcome(snapshot(CommandState.COMPLETED, 1_500));

        Counter counter = registry.find("petpal.command.outcome")
                .tag("kind", "pick up the ball")
                .tag("state", "completed")
                .counter();
        Timer timer = registry.find("petpal.command.duration").tag("state", "completed").timer();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
        assertThat(timer).isNotNull();
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1_500.0);
    }

    @Test
    void shouldIgnoreNonTerminalSnapshots() {
        metrics.recordOutcome(snapshot(CommandState.EXECUTING, 100));

        assertThat(registry.find("petpal.command.outcome").counter()).isNull();
    }

    @Test
    void shouldCountRejectionsByReason() {
        metrics.incrementRejected("busy");
        metrics.incrementRejected("busy");
        metrics.incrementRejected("invalid");

        assertThat(registry.find("petpal.command.rejected").tag("reason", "busy").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("petpal.command.rejected").tag("reason", "invalid").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordPhaseDurations() {
        metrics.recordPhase("approach", 200);
        metrics.recordPhase("approach", 300);

        Timer timer = registry.find("petpal.phase.duration").tag("phase", "approach").timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(500.0);
    }
}
