package com.phillippitts.petpal.service.capability.mock;

import com.phillippitts.petpal.service.capability.CameraAdapter;
import com.phillippitts.petpal.service.capability.CameraFrame;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated camera producing numbered frame handles.
 */
public class MockCameraAdapter implements CameraAdapter {

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public CameraFrame captureFrame() {
        return new CameraFrame(sequence.incrementAndGet(), Instant.now(), null);
    }
}
