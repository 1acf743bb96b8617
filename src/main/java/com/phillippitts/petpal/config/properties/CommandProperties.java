package com.phillippitts.petpal.config.properties;

import com.phillippitts.petpal.domain.Phase;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for command orchestration: timeouts, cadence, confidence gating and
 * retention of finished command records.
 */
@Validated
@ConfigurationProperties(prefix = "petpal.command")
public class CommandProperties {

    /** Number of most recent command records kept for status lookups. */
    @Min(value = 2, message = "Retention must keep at least the active and the preempted record")
    private int retention = 100;

    /** Executor control-loop cadence in milliseconds (50ms = 20 Hz). */
    @Positive
    private long pollIntervalMs = 50;

    /** Overall timeout of a command, measured from acceptance. */
    @Positive
    private long commandTimeoutMs = 30_000;

    /** Timeout of a phase that has no entry in {@link #phaseTimeoutsMs}. */
    @Positive
    private long defaultPhaseTimeoutMs = 5_000;

    /** Per-phase timeout overrides keyed by phase wire name (e.g. {@code approach}). */
    private Map<String, Long> phaseTimeoutsMs = new HashMap<>();

    /** Minimum detector confidence for a detection phase to succeed. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.6;

    /** Extra detection attempts after a low-confidence result. */
    @Min(0)
    private int detectionRetryLimit = 2;

    /** Deadline of the preemptive safe-state command. */
    @Positive
    private long safeTimeoutMs = 1_000;

    /** Max per-joint distance (radians) at which a target pose counts as reached. */
    @Positive
    private double positionTolerance = 0.02;

    /** Symmetric per-joint limit (radians) enforced before every actuation. */
    @Positive
    private double jointLimitRad = 2.5;

    /** Max absolute elbow angle (radians) from which the ball throw may start. */
    @Positive
    private double throwReadyRad = 0.25;

    public long phaseTimeoutMs(Phase phase) {
        Long override = phaseTimeoutsMs.get(phase.wireName());
        return override != null ? override : defaultPhaseTimeoutMs;
    }

    public int getRetention() {
        return retention;
    }

    public void setRetention(int retention) {
        this.retention = retention;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    public void setCommandTimeoutMs(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
    }

    public long getDefaultPhaseTimeoutMs() {
        return defaultPhaseTimeoutMs;
    }

    public void setDefaultPhaseTimeoutMs(long defaultPhaseTimeoutMs) {
        this.defaultPhaseTimeoutMs = defaultPhaseTimeoutMs;
    }

    public Map<String, Long> getPhaseTimeoutsMs() {
        return phaseTimeoutsMs;
    }

    public void setPhaseTimeoutsMs(Map<String, Long> phaseTimeoutsMs) {
        this.phaseTimeoutsMs = phaseTimeoutsMs == null ? new HashMap<>() : phaseTimeoutsMs;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getDetectionRetryLimit() {
        return detectionRetryLimit;
    }

    public void setDetectionRetryLimit(int detectionRetryLimit) {
        this.detectionRetryLimit = detectionRetryLimit;
    }

    public long getSafeTimeoutMs() {
        return safeTimeoutMs;
    }

    public void setSafeTimeoutMs(long safeTimeoutMs) {
        this.safeTimeoutMs = safeTimeoutMs;
    }

    public double getPositionTolerance() {
        return positionTolerance;
    }

    public void setPositionTolerance(double positionTolerance) {
        this.positionTolerance = positionTolerance;
    }

    public double getJointLimitRad() {
        return jointLimitRad;
    }

    public void setJointLimitRad(double jointLimitRad) {
        this.jointLimitRad = jointLimitRad;
    }

    public double getThrowReadyRad() {
        return throwReadyRad;
    }

    public void setThrowReadyRad(double throwReadyRad) {
        this.throwReadyRad = throwReadyRad;
    }
}
