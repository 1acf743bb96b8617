package com.phillippitts.petpal.domain;

import java.util.Objects;

/**
 * Labeled output of the black-box detector.
 *
 * @param label      class or action label
 * @param confidence confidence score in [0,1]
 * @param geometry   bounding box in normalized image coordinates, nullable for actions
 */
public record Detection(String label, double confidence, BoundingBox geometry) {

    public Detection {
        Objects.requireNonNull(label, "label must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static Detection of(String label, double confidence) {
        return new Detection(label, confidence, null);
    }

    /**
     * Axis-aligned bounding box.
     */
    public record BoundingBox(double x, double y, double width, double height) { }
}
