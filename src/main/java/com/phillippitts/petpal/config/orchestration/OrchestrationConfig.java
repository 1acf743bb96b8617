package com.phillippitts.petpal.config.orchestration;

import com.phillippitts.petpal.config.properties.CommandProperties;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.capability.ArmAdapter;
import com.phillippitts.petpal.service.capability.CameraAdapter;
import com.phillippitts.petpal.service.capability.CapabilityInvoker;
import com.phillippitts.petpal.service.capability.DetectorAdapter;
import com.phillippitts.petpal.service.capability.SafetyValidator;
import com.phillippitts.petpal.service.capability.WorkspaceMonitor;
import com.phillippitts.petpal.service.command.CommandExecutor;
import com.phillippitts.petpal.service.command.CommandService;
import com.phillippitts.petpal.service.command.CommandStateMachine;
import com.phillippitts.petpal.service.command.CommandStatusPublisher;
import com.phillippitts.petpal.service.command.CommandStore;
import com.phillippitts.petpal.service.command.PreemptionController;
import com.phillippitts.petpal.service.events.EventBuffer;
import com.phillippitts.petpal.service.health.CommandOrchestratorHealthIndicator;
import com.phillippitts.petpal.service.metrics.CommandMetrics;
import com.phillippitts.petpal.util.MonotonicClock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the command orchestration stack explicitly.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class OrchestrationConfig {

    private final CommandProperties commandProperties;
    private final CommandMetrics metrics;
    private final Executor commandExecutor;
    private final Executor safeStateExecutor;

    public OrchestrationConfig(CommandProperties commandProperties,
                               CommandMetrics metrics,
                               @Qualifier("commandExecutor") Executor commandExecutor,
                               @Qualifier("safeStateExecutor") Executor safeStateExecutor) {
        this.commandProperties = commandProperties;
        this.metrics = metrics;
        this.commandExecutor = commandExecutor;
        this.safeStateExecutor = safeStateExecutor;
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.SYSTEM;
    }

    @Bean
    public CommandStore commandStore() {
        return new CommandStore(commandProperties.getRetention());
    }

    /**
     * State machine publishing every transition to the broadcast hub.
     */
    @Bean
    public CommandStateMachine commandStateMachine(CommandStore store, BroadcastHub hub, MonotonicClock clock) {
        return new CommandStateMachine(store, commandProperties.getCommandTimeoutMs(), clock,
                new CommandStatusPublisher(hub, metrics));
    }

    @Bean
    public CommandExecutor phaseExecutor(CommandStateMachine stateMachine,
                                         ArmAdapter arm,
                                         CameraAdapter camera,
                                         DetectorAdapter detector,
                                         WorkspaceMonitor workspace,
                                         SafetyValidator safety,
                                         CapabilityInvoker invoker,
                                         MonotonicClock clock) {
        return new CommandExecutor(stateMachine, commandProperties, arm, camera, detector, workspace, safety,
                invoker, clock, metrics);
    }

    @Bean
    public PreemptionController preemptionController(CommandStateMachine stateMachine,
                                                     ArmAdapter arm,
                                                     CapabilityInvoker invoker,
                                                     MonotonicClock clock) {
        return new PreemptionController(stateMachine, commandProperties, arm, invoker, safeStateExecutor, clock);
    }

    @Bean
    public CommandService commandService(CommandStateMachine stateMachine,
                                         CommandStore store,
                                         CommandExecutor phaseExecutor,
                                         PreemptionController preemptionController) {
        return new CommandService(stateMachine, store, phaseExecutor, preemptionController, commandExecutor, metrics);
    }

    @Bean
    public CommandOrchestratorHealthIndicator commandOrchestratorHealthIndicator(CommandService commandService,
                                                                                 BroadcastHub hub,
                                                                                 EventBuffer eventBuffer) {
        return new CommandOrchestratorHealthIndicator(commandService, hub, eventBuffer);
    }
}
