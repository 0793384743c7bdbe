package com.phillippitts.navguide.service.events;

import com.phillippitts.navguide.service.session.event.SessionResetEvent;
import com.phillippitts.navguide.service.speech.event.AnnouncementSpokenEvent;
import com.phillippitts.navguide.service.speech.event.SpeechFailedEvent;
import com.phillippitts.navguide.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for navigation events. Speech failures are throttled per tier and reason
 * so a dead audio device does not flood the log.
 */
@Component
class NavigationEventsListener {
    private static final Logger LOG = LogManager.getLogger(NavigationEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    NavigationEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onAnnouncementSpoken(AnnouncementSpokenEvent e) {
        LOG.debug("Spoken [{}{}] at {}: \"{}\"", e.tier(), e.interrupt() ? ", interrupt" : "",
                e.timestamp(), LogSanitizer.preview(e.text(), 60));
    }

    @EventListener
    void onSpeechFailed(SpeechFailedEvent e) {
        if (shouldLog("speech-" + e.tier() + '-' + e.reason())) {
            LOG.warn("Speech output failing: tier={}, reason={}. Check the speech sink.", e.tier(), e.reason());
        }
    }

    @EventListener
    void onSessionReset(SessionResetEvent e) {
        LOG.info("Session {} replaced by {} at {}", e.previousSessionId(), e.sessionId(), e.timestamp());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
