package com.phillippitts.petpal.service.capability;

import java.time.Instant;

/**
 * Opaque handle to a captured camera frame. The orchestrator never looks at pixels; it only
 * passes the handle from the camera to the detector.
 *
 * @param sequence         monotonically increasing frame number
 * @param capturedAt       capture time
 * @param mediaTimestampMs position in the recorded stream, nullable
 */
public record CameraFrame(long sequence, Instant capturedAt, Long mediaTimestampMs) {
}
