package com.phillippitts.navguide.service.speech;

import java.util.Objects;

/**
 * A single utterance request.
 *
 * @param text      text to speak (non-blank)
 * @param tier      priority tier
 * @param interrupt if {@code true}, preempt anything queued or playing
 */
public record Announcement(String text, SpeechTier tier, boolean interrupt) {

    public Announcement {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(tier, "tier");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Announcement text must not be blank");
        }
    }
}
