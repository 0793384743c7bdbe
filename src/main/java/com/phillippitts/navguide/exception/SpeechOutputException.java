package com.phillippitts.navguide.exception;

import com.phillippitts.navguide.service.speech.SpeechTier;

/**
 * Thrown when the speech sink fails to accept an utterance.
 * The arbiter catches this internally; it only surfaces through direct callers
 * such as the scene description endpoint.
 */
public class SpeechOutputException extends NavGuideException {

    private final SpeechTier tier;

    public SpeechOutputException(String message, SpeechTier tier) {
        super(message + " (tier: " + tier + ")");
        this.tier = tier;
    }

    public SpeechOutputException(String message, SpeechTier tier, Throwable cause) {
        super(message + " (tier: " + tier + ")", cause);
        this.tier = tier;
    }

    public SpeechTier getTier() {
        return tier;
    }
}
