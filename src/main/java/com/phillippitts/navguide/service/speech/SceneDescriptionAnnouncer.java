package com.phillippitts.navguide.service.speech;

import com.phillippitts.navguide.exception.SpeechOutputException;
import com.phillippitts.navguide.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Speaks an externally produced scene description ("analyze surroundings").
 *
 * <p>Descriptions are NAVIGATION tier and interrupt whatever is playing. The returned future
 * completes once the sink accepted the text, or fails with {@link SpeechOutputException}.
 */
public final class SceneDescriptionAnnouncer {

    private static final Logger LOG = LogManager.getLogger(SceneDescriptionAnnouncer.class);

    private final SpeechArbiter arbiter;

    public SceneDescriptionAnnouncer(SpeechArbiter arbiter) {
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
    }

    public CompletableFuture<Void> announce(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Scene description must not be blank");
        }
        String text = description.strip();
        LOG.info("Announcing scene description ({} chars): \"{}\"", text.length(), LogSanitizer.preview(text, 60));
        return arbiter.requestAsync(new Announcement(text, SpeechTier.NAVIGATION, true))
                .thenAccept(spoken -> {
                    if (!spoken) {
                        throw new SpeechOutputException("Scene description was not spoken", SpeechTier.NAVIGATION);
                    }
                });
    }
}
