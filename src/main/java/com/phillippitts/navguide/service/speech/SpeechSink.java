package com.phillippitts.navguide.service.speech;

/**
 * Request contract of the external text-to-speech engine.
 *
 * <p>Implementations are invoked from the single speech worker thread, so they never see
 * concurrent calls. They may block for as long as enqueueing the utterance takes; the
 * pipeline never waits for playback.
 */
public interface SpeechSink {

    /**
     * Speaks the text, flushing the engine's queue first when {@code interrupt} is set.
     *
     * @return {@code true} if the engine accepted the utterance
     */
    boolean speak(String text, boolean interrupt, SpeechTier tier);

    /**
     * Stops current playback and drops anything queued. Default: no-op.
     */
    default void stop() {
    }

    /**
     * Short name used in logs and metrics.
     */
    String name();
}
