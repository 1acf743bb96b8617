package com.phillippitts.petpal.service.capability.mock;

import com.phillippitts.petpal.service.capability.SpeechAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Simulated speaker; logs the utterance length only.
 */
public class MockSpeechAdapter implements SpeechAdapter {

    private static final Logger LOG = LogManager.getLogger(MockSpeechAdapter.class);

    @Override
    public void speak(String text) {
        LOG.info("Mock speaker said {} chars", text.length());
    }
}
