package com.phillippitts.navguide.service.speech;

import com.phillippitts.navguide.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sink that writes utterances to the log instead of an audio device.
 *
 * <p>Registered when no other {@link SpeechSink} bean is present. Real text-to-speech lives
 * in the client that posts frames.
 */
public class LoggingSpeechSink implements SpeechSink {

    private static final Logger LOG = LogManager.getLogger(LoggingSpeechSink.class);

    static final int MAX_LOGGED_CHARS = 120;

    @Override
    public boolean speak(String text, boolean interrupt, SpeechTier tier) {
        LOG.info("SPEAK [{}{}] \"{}\"", tier, interrupt ? ", interrupt" : "",
                LogSanitizer.preview(text, MAX_LOGGED_CHARS));
        return true;
    }

    @Override
    public void stop() {
        LOG.info("Speech stopped");
    }

    @Override
    public String name() {
        return "logging";
    }
}
