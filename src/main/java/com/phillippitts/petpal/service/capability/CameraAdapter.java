package com.phillippitts.petpal.service.capability;

/**
 * Sensor capability supplying frames to the detector.
 */
public interface CameraAdapter {

    CameraFrame captureFrame();
}
