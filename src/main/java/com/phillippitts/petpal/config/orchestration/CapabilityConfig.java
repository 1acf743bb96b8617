package com.phillippitts.petpal.config.orchestration;

import com.phillippitts.petpal.config.properties.ActionProperties;
import com.phillippitts.petpal.config.properties.CapabilityProperties;
import com.phillippitts.petpal.config.properties.CommandProperties;
import com.phillippitts.petpal.service.capability.ArmAdapter;
import com.phillippitts.petpal.service.capability.CameraAdapter;
import com.phillippitts.petpal.service.capability.CapabilityInvoker;
import com.phillippitts.petpal.service.capability.DetectorAdapter;
import com.phillippitts.petpal.service.capability.DirectActionService;
import com.phillippitts.petpal.service.capability.DispenserAdapter;
import com.phillippitts.petpal.service.capability.SafetyValidator;
import com.phillippitts.petpal.service.capability.SpeechAdapter;
import com.phillippitts.petpal.service.capability.WorkspaceMonitor;
import com.phillippitts.petpal.service.capability.mock.MockArmAdapter;
import com.phillippitts.petpal.service.capability.mock.MockCameraAdapter;
import com.phillippitts.petpal.service.capability.mock.MockDetectorAdapter;
import com.phillippitts.petpal.service.capability.mock.MockDispenserAdapter;
import com.phillippitts.petpal.service.capability.mock.MockSpeechAdapter;
import com.phillippitts.petpal.service.capability.mock.MockWorkspaceMonitor;
import com.phillippitts.petpal.service.validation.ActionRequestValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires capability adapters and the bounded invoker.
 *
 * <p>Every adapter is registered as a fallback: a bean of the same interface defined elsewhere
 * (a hardware driver) replaces the simulated one.
 */
@Configuration
public class CapabilityConfig {

    private static final Logger LOG = LogManager.getLogger(CapabilityConfig.class);

    @Bean
    @ConditionalOnMissingBean(ArmAdapter.class)
    public ArmAdapter armAdapter(CapabilityProperties props) {
        LOG.info("No arm driver configured; using simulated arm (step={} rad)", props.getArmStepRad());
        return new MockArmAdapter(props.getArmStepRad());
    }

    @Bean
    @ConditionalOnMissingBean(CameraAdapter.class)
    public CameraAdapter cameraAdapter() {
        return new MockCameraAdapter();
    }

    @Bean
    @ConditionalOnMissingBean(DetectorAdapter.class)
    public DetectorAdapter detectorAdapter(CapabilityProperties props) {
        return new MockDetectorAdapter(props);
    }

    @Bean
    @ConditionalOnMissingBean(WorkspaceMonitor.class)
    public WorkspaceMonitor workspaceMonitor(CapabilityProperties props) {
        return new MockWorkspaceMonitor(props.isWorkspaceClear());
    }

    @Bean
    @ConditionalOnMissingBean(DispenserAdapter.class)
    public DispenserAdapter dispenserAdapter() {
        return new MockDispenserAdapter();
    }

    @Bean
    @ConditionalOnMissingBean(SpeechAdapter.class)
    public SpeechAdapter speechAdapter() {
        return new MockSpeechAdapter();
    }

    @Bean
    public SafetyValidator safetyValidator(CommandProperties props) {
        return new SafetyValidator(props.getJointLimitRad(), props.getThrowReadyRad());
    }

    @Bean
    public CapabilityInvoker capabilityInvoker(@Qualifier("capabilityExecutor") Executor capabilityExecutor,
                                               ApplicationEventPublisher publisher) {
        return new CapabilityInvoker(capabilityExecutor, publisher);
    }

    @Bean
    public DirectActionService directActionService(DispenserAdapter dispenser,
                                                   SpeechAdapter speech,
                                                   CapabilityInvoker invoker,
                                                   ActionRequestValidator validator,
                                                   ActionProperties props) {
        return new DirectActionService(dispenser, speech, invoker, validator, props);
    }
}
