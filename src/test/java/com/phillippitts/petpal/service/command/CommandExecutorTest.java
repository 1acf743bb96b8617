package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.config.properties.CapabilityProperties;
import com.phillippitts.petpal.config.properties.CommandProperties;
import com.phillippitts.petpal.domain.CommandKind;
import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.service.capability.ArmAdapter;
import com.phillippitts.petpal.service.capability.CapabilityInvoker;
import com.phillippitts.petpal.service.capability.DetectorAdapter;
import com.phillippitts.petpal.service.capability.SafetyValidator;
import com.phillippitts.petpal.service.capability.WorkspaceMonitor;
import com.phillippitts.petpal.service.capability.mock.MockArmAdapter;
import com.phillippitts.petpal.service.capability.mock.MockDetectorAdapter;
import com.phillippitts.petpal.service.capability.mock.MockWorkspaceMonitor;
import com.phillippitts.petpal.service.metrics.CommandMetrics;
import com.phillippitts.petpal.util.MonotonicClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.petpal.service.command.CommandTestDoubles.FailingDetector;
import static com.phillippitts.petpal.service.command.CommandTestDoubles.FixedCamera;
import static com.phillippitts.petpal.service.command.CommandTestDoubles.HangingArm;
import static com.phillippitts.petpal.service.command.CommandTestDoubles.ScriptedDetector;
import static com.phillippitts.petpal.service.command.CommandTestDoubles.StuckArm;
import static com.phillippitts.petpal.service.command.CommandTestDoubles.fastProperties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class CommandExecutorTest {

    private final ExecutorService capabilityPool = Executors.newCachedThreadPool();
    private final CommandStore store = new CommandStore(10);
    private final CommandStateMachine machine =
            new CommandStateMachine(store, 10_000, MonotonicClock.SYSTEM, CommandStatusListener.NOOP);

    @AfterEach
    void tearDown() {
        capabilityPool.shutdownNow();
    }

    private CommandExecutor executor(CommandProperties props, ArmAdapter arm, DetectorAdapter detector,
                                     CommandMetrics metrics) {
        return new CommandExecutor(machine, props, arm, new FixedCamera(), detector, new MockWorkspaceMonitor(true),
                new SafetyValidator(props.getJointLimitRad()), new CapabilityInvoker(capabilityPool, null),
                MonotonicClock.SYSTEM, metrics);
    }

    private CommandExecutor executor(ArmAdapter arm, WorkspaceMonitor workspace, SafetyValidator safety) {
        return new CommandExecutor(machine, fastProperties(), arm, new FixedCamera(),
                new MockDetectorAdapter(new CapabilityProperties()), workspace, safety,
                new CapabilityInvoker(capabilityPool, null), MonotonicClock.SYSTEM, null);
    }

    private CommandRecord accept(CommandKind kind) {
        return machine.accept(kind).accepted();
    }

    @Test
    void shouldCompleteEveryPhaseWithCooperativeAdapters() {
        // Arrange
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CommandExecutor executor = executor(fastProperties(), new MockArmAdapter(2.5),
                new MockDetectorAdapter(new CapabilityProperties()), new CommandMetrics(registry));
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        CommandSnapshot snapshot = record.snapshot();
        assertThat(snapshot.state()).isEqualTo(CommandState.COMPLETED);
        assertThat(snapshot.message()).isEqualTo("Completed: pick up the ball");
        assertThat(snapshot.completedPhases())
                .containsExactly("detect", "approach", "grasp", "lift", "ready_to_throw", "throw");
        assertThat(snapshot.confidence()).isEqualTo(0.85);
        assertThat(registry.get("petpal.phase.duration").tag("phase", "grasp").timer().count()).isEqualTo(1);
        assertThat(machine.isIdle()).isTrue();
    }

    @Test
    void shouldThrowBallWhenArmIsReadyAndWorkspaceIsClear() {
        // Arrange
        AtomicInteger throwsIssued = new AtomicInteger();
        MockArmAdapter arm = new MockArmAdapter(2.5) {
            @Override
            public synchronized void throwMacro() {
                throwsIssued.incrementAndGet();
                super.throwMacro();
            }
        };
        CommandExecutor executor = executor(arm, new MockWorkspaceMonitor(true), new SafetyValidator(2.5));
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().state()).isEqualTo(CommandState.COMPLETED);
        assertThat(record.snapshot().completedPhases()).endsWith("ready_to_throw", "throw");
        assertThat(throwsIssued.get()).isEqualTo(1);
        assertThat(arm.observe().moving()).isFalse();
    }

    @Test
    void shouldSkipThrowWhenWorkspaceIsNotClear() {
        // Arrange
        CommandExecutor executor = executor(new MockArmAdapter(2.5), new MockWorkspaceMonitor(false),
                new SafetyValidator(2.5));
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        CommandSnapshot snapshot = record.snapshot();
        assertThat(snapshot.state()).isEqualTo(CommandState.COMPLETED);
        assertThat(snapshot.message()).isEqualTo("Completed: pick up the ball (throw skipped: workspace not clear)");
        assertThat(snapshot.completedPhases()).endsWith("lift", "ready_to_throw").doesNotContain("throw");
        assertThat(snapshot.phase()).isEqualTo("ready_to_throw");
    }

    @Test
    void shouldSkipThrowWithoutConsultingWorkspaceWhenElbowIsOutOfPosition() {
        // Arrange
        AtomicInteger workspaceChecks = new AtomicInteger();
        WorkspaceMonitor workspace = () -> {
            workspaceChecks.incrementAndGet();
            return true;
        };
        CommandExecutor executor = executor(new MockArmAdapter(2.5), workspace, new SafetyValidator(2.5, 0.1));
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().state()).isEqualTo(CommandState.COMPLETED);
        assertThat(record.snapshot().message()).isEqualTo("Completed: pick up the ball "
                + "(throw skipped: arm not ready to throw: joint 2 at 0.200, needs to be within ±0.10 rad)");
        assertThat(record.snapshot().completedPhases()).doesNotContain("throw");
        assertThat(record.snapshot().phase()).isEqualTo("ready_to_throw");
        assertThat(workspaceChecks.get()).isZero();
    }

    @Test
    void shouldLeaveTreatCommandWithoutHandoff() {
        // Arrange
        CommandExecutor executor = executor(new MockArmAdapter(2.5), new MockWorkspaceMonitor(false),
                new SafetyValidator(2.5));
        CommandRecord record = accept(CommandKind.GET_TREAT);

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().message()).isEqualTo("Completed: get the treat");
    }

    @Test
    void shouldRetryLowConfidenceDetectionThenProceed() {
        // Arrange
        ScriptedDetector detector = new ScriptedDetector(0.3, 0.9);
        CommandExecutor executor = executor(fastProperties(), new MockArmAdapter(2.5), detector, null);
        CommandRecord record = accept(CommandKind.GET_TREAT);

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().state()).isEqualTo(CommandState.COMPLETED);
        assertThat(record.snapshot().completedPhases()).containsExactly("detect", "approach", "grasp", "lift", "drop");
        assertThat(detector.calls()).isEqualTo(2);
    }

    @Test
    void shouldFailWhenConfidenceStaysBelowThresholdAfterRetries() {
        // Arrange
        ScriptedDetector detector = new ScriptedDetector(0.3);
        StuckArm arm = new StuckArm();
        CommandExecutor executor = executor(fastProperties(), arm, detector, null);
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        CommandSnapshot snapshot = record.snapshot();
        assertThat(snapshot.state()).isEqualTo(CommandState.FAILED);
        assertThat(snapshot.message())
                .isEqualTo("Could not detect ball: confidence 0.30 below threshold 0.60 after 3 attempts");
        assertThat(snapshot.confidence()).isEqualTo(0.3);
        assertThat(detector.calls()).isEqualTo(3);
        assertThat(arm.actuations.get()).isZero();
    }

    @Test
    void shouldTimeOutPhaseWhenArmNeverArrives() {
        // Arrange
        CommandProperties props = fastProperties();
        props.setDefaultPhaseTimeoutMs(200);
        CommandExecutor executor = executor(props, new StuckArm(), new ScriptedDetector(0.9), null);
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        CommandSnapshot snapshot = record.snapshot();
        assertThat(snapshot.state()).isEqualTo(CommandState.TIMEOUT);
        assertThat(snapshot.phase()).isEqualTo("approach");
        assertThat(snapshot.message()).isEqualTo("Phase approach did not complete within 200ms");
        // phase timeout plus one poll interval, with scheduling slack
        assertThat(snapshot.elapsedMs()).isLessThan(200 + 10 + 300);
    }

    @Test
    void shouldBoundHungAdapterCallByPhaseTimeout() {
        // Arrange
        CommandProperties props = fastProperties();
        props.setDefaultPhaseTimeoutMs(200);
        CommandExecutor executor = executor(props, new HangingArm(), new ScriptedDetector(0.9), null);
        CommandRecord record = accept(CommandKind.GET_TREAT);
        long start = System.nanoTime();

        // Act
        executor.execute(record);

        // Assert
        long tookMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(record.snapshot().state()).isEqualTo(CommandState.TIMEOUT);
        assertThat(record.snapshot().message()).startsWith("Phase approach timed out");
        assertThat(tookMs).isLessThan(1_000);
    }

    @Test
    void shouldTimeOutWhenOverallBudgetIsExhausted() {
        // Arrange
        CommandStateMachine shortBudget =
                new CommandStateMachine(store, 150, MonotonicClock.SYSTEM, CommandStatusListener.NOOP);
        CommandProperties props = fastProperties();
        CommandExecutor executor = new CommandExecutor(shortBudget, props, new StuckArm(), new FixedCamera(),
                new ScriptedDetector(0.9), new MockWorkspaceMonitor(true),
                new SafetyValidator(props.getJointLimitRad()), new CapabilityInvoker(capabilityPool, null),
                MonotonicClock.SYSTEM, null);
        CommandRecord record = shortBudget.accept(CommandKind.PICK_UP_BALL).accepted();

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().state()).isEqualTo(CommandState.TIMEOUT);
        assertThat(record.snapshot().message()).isEqualTo("Command exceeded its 150ms timeout");
    }

    @Test
    void shouldFailWithAdapterDetailWhenDetectorRaises() {
        // Arrange
        CommandExecutor executor = executor(fastProperties(), new StuckArm(), new FailingDetector(), null);
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().state()).isEqualTo(CommandState.FAILED);
        assertThat(record.snapshot().message()).startsWith("Phase detect failed").contains("lens cap on");
    }

    @Test
    void shouldFailWithoutMovingWhenTargetViolatesJointLimits() {
        // Arrange
        CommandProperties props = fastProperties();
        props.setJointLimitRad(0.15);
        StuckArm arm = new StuckArm();
        CommandExecutor executor = executor(props, arm, new ScriptedDetector(0.9), null);
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);

        // Act
        executor.execute(record);

        // Assert
        assertThat(record.snapshot().state()).isEqualTo(CommandState.FAILED);
        assertThat(record.snapshot().message()).startsWith("safety check failed: joint 1");
        assertThat(arm.actuations.get()).isZero();
    }

    @Test
    void shouldStopIssuingAdapterCallsOnceInterrupted() throws Exception {
        // Arrange
        StuckArm arm = new StuckArm();
        CommandProperties props = fastProperties();
        props.setDefaultPhaseTimeoutMs(5_000);
        CommandExecutor executor = executor(props, arm, new ScriptedDetector(0.9), null);
        CommandRecord record = accept(CommandKind.PICK_UP_BALL);
        Thread worker = new Thread(() -> executor.execute(record), "command-test");
        worker.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> "approach".equals(record.snapshot().phase()));

        // Act
        machine.accept(CommandKind.GO_HOME);

        // Assert
        assertThat(record.awaitStopped(props.getPollIntervalMs() + 200)).isTrue();
        assertThat(record.snapshot().state()).isEqualTo(CommandState.INTERRUPTED);
        assertThat(record.snapshot().message()).isEqualTo("Interrupted by go home");
        int actuationsAfterStop = arm.actuations.get();
        Thread.sleep(50);
        assertThat(arm.actuations.get()).isEqualTo(actuationsAfterStop);
        worker.join(1_000);
    }
}
