package com.phillippitts.petpal.service.capability.mock;

import com.phillippitts.petpal.config.properties.CapabilityProperties;
import com.phillippitts.petpal.domain.Detection;
import com.phillippitts.petpal.service.capability.CameraFrame;
import com.phillippitts.petpal.service.capability.DetectorAdapter;

/**
 * Simulated detector reporting a fixed, configurable confidence per target label and a centered
 * bounding box.
 */
public class MockDetectorAdapter implements DetectorAdapter {

    private final CapabilityProperties properties;

    public MockDetectorAdapter(CapabilityProperties properties) {
        this.properties = properties;
    }

    @Override
    public Detection detect(CameraFrame frame, String targetLabel) {
        double confidence = properties.getDetectorConfidence()
                .getOrDefault(targetLabel, properties.getDetectorDefaultConfidence());
        return new Detection(targetLabel, confidence, new Detection.BoundingBox(0.4, 0.4, 0.2, 0.2));
    }
}
