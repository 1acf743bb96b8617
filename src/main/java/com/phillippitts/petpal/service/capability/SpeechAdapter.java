package com.phillippitts.petpal.service.capability;

/**
 * Text-to-speech output through the robot's speaker.
 */
public interface SpeechAdapter {

    void speak(String text);
}
