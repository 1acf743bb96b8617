package com.phillippitts.petpal.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Tuning for the simulated capability adapters used when no hardware is attached.
 */
@Validated
@ConfigurationProperties(prefix = "petpal.capability")
public class CapabilityProperties {

    /** Max joint travel (radians) the simulated arm covers per observation. */
    @Positive
    private double armStepRad = 0.25;

    /** Confidence the simulated detector reports for a label with no entry below. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double detectorDefaultConfidence = 0.7;

    /** Confidence the simulated detector reports per target label. */
    private Map<String, Double> detectorConfidence = new HashMap<>(Map.of("ball", 0.85, "treat", 0.8));

    /** What the simulated workspace monitor reports. */
    private boolean workspaceClear = true;

    public double getArmStepRad() {
        return armStepRad;
    }

    public void setArmStepRad(double armStepRad) {
        this.armStepRad = armStepRad;
    }

    public double getDetectorDefaultConfidence() {
        return detectorDefaultConfidence;
    }

    public void setDetectorDefaultConfidence(double detectorDefaultConfidence) {
        this.detectorDefaultConfidence = detectorDefaultConfidence;
    }

    public Map<String, Double> getDetectorConfidence() {
        return detectorConfidence;
    }

    public void setDetectorConfidence(Map<String, Double> detectorConfidence) {
        this.detectorConfidence = detectorConfidence == null ? new HashMap<>() : detectorConfidence;
    }

    public boolean isWorkspaceClear() {
        return workspaceClear;
    }

    public void setWorkspaceClear(boolean workspaceClear) {
        this.workspaceClear = workspaceClear;
    }
}
