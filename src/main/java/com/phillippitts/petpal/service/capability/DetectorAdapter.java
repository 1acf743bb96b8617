package com.phillippitts.petpal.service.capability;

import com.phillippitts.petpal.domain.Detection;

/**
 * Black-box classifier returning a labeled detection with a confidence score.
 */
public interface DetectorAdapter {

    /**
     * Looks for the target in the given frame.
     *
     * @param frame       frame handle from the camera
     * @param targetLabel label the current command is looking for (e.g. {@code ball})
     * @return best detection for the target; a confidence of 0 means not found
     */
    Detection detect(CameraFrame frame, String targetLabel);
}
