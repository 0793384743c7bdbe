package com.phillippitts.navguide.service.speech;

/**
 * Speech priority tiers, declared from highest to lowest.
 */
public enum SpeechTier {
    /** Stop and danger warnings. */
    URGENT,
    /** Step, straight and path-clear guidance, and manual scene descriptions. */
    NAVIGATION,
    /** Ambient closest-object narration; muted while a suppression window is open. */
    INFORMATION;

    /**
     * Returns {@code true} if this tier has strictly higher priority than {@code other}.
     */
    public boolean outranks(SpeechTier other) {
        return compareTo(other) < 0;
    }
}
