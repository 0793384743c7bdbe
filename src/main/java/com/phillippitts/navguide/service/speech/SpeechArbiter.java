package com.phillippitts.navguide.service.speech;

import com.phillippitts.navguide.config.properties.SpeechProperties;
import com.phillippitts.navguide.service.gate.SuppressionReason;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.service.speech.event.AnnouncementSpokenEvent;
import com.phillippitts.navguide.service.speech.event.SpeechFailedEvent;
import com.phillippitts.navguide.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes announcement requests from all producers onto one {@link SpeechSink}.
 *
 * <p><b>Sequencing:</b> accepted requests are handed to a single-threaded executor, so the
 * sink sees them in acceptance order. An interrupting request marks every earlier request
 * that has not yet reached the sink as stale; stale requests are skipped when their turn comes.
 *
 * <p><b>Suppression:</b> every accepted URGENT or NAVIGATION request opens a window of
 * {@code nav.speech.suppression-ms} during which INFORMATION requests are dropped.
 * Producers can query {@link #isSuppressed(SpeechTier)} before building their text.
 *
 * <p><b>Failures:</b> the sink call is fire-and-forget. Sink errors are logged at WARN,
 * counted and published as {@link SpeechFailedEvent}; they never reach the producer.
 *
 * <p><b>Thread Safety:</b> all state is guarded by one {@link ReentrantLock}. Callers that
 * hold their own lock (the gates) must acquire it before calling in, never the reverse.
 *
 * <p>The arbiter never decides content; it only sequences and mutes.
 *
 * @since 1.0
 */
public final class SpeechArbiter {

    private static final Logger LOG = LogManager.getLogger(SpeechArbiter.class);

    private static final int MAX_LOGGED_CHARS = 80;

    private final Lock lock = new ReentrantLock();
    private final SpeechProperties properties;
    private final SpeechSink sink;
    private final Executor speechExecutor;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final NavigationMetricsPublisher metrics;

    private Instant suppressedUntil;
    private SpeechTier inFlightTier;
    private long inFlightGeneration;
    private long generation;
    private long staleBefore;

    public SpeechArbiter(SpeechProperties properties,
                         SpeechSink sink,
                         Executor speechExecutor,
                         Clock clock,
                         ApplicationEventPublisher publisher,
                         NavigationMetricsPublisher metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.speechExecutor = Objects.requireNonNull(speechExecutor, "speechExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? NavigationMetricsPublisher.NOOP : metrics;
    }

    /**
     * Requests speech output.
     *
     * @param text      text to speak
     * @param tier      priority tier
     * @param interrupt preempt queued and playing output
     * @return {@code true} if the request was accepted and handed to the sink,
     *         {@code false} if it was dropped (suppressed INFORMATION, blank text, executor full)
     */
    public boolean request(String text, SpeechTier tier, boolean interrupt) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return submit(new Announcement(text, tier, interrupt)) != null;
    }

    /**
     * Requests speech output and exposes the sink's outcome.
     *
     * @return future completing with the sink's result once the utterance was handed over,
     *         {@code false} if the request was dropped or skipped as stale
     */
    public CompletableFuture<Boolean> requestAsync(Announcement announcement) {
        CompletableFuture<Boolean> outcome = submit(announcement);
        return outcome == null ? CompletableFuture.completedFuture(false) : outcome;
    }

    private CompletableFuture<Boolean> submit(Announcement announcement) {
        Objects.requireNonNull(announcement, "announcement");
        lock.lock();
        try {
            Instant now = clock.instant();
            if (announcement.tier() == SpeechTier.INFORMATION && isSuppressedAt(now)) {
                LOG.debug("Dropped INFORMATION request, suppressed for {}ms more: \"{}\"",
                        Duration.between(now, suppressedUntil).toMillis(),
                        LogSanitizer.preview(announcement.text(), MAX_LOGGED_CHARS));
                metrics.recordSuppressed("arbiter", SuppressionReason.INFORMATION_SUPPRESSED);
                return null;
            }

            long previousStaleBefore = staleBefore;
            long gen = ++generation;
            if (announcement.interrupt()) {
                staleBefore = gen;
            }
            SpeechTier previousTier = inFlightTier;
            long previousInFlight = inFlightGeneration;
            inFlightTier = announcement.tier();
            inFlightGeneration = gen;

            CompletableFuture<Boolean> outcome = new CompletableFuture<>();
            try {
                speechExecutor.execute(() -> deliver(announcement, gen, now, outcome));
            } catch (RejectedExecutionException e) {
                LOG.warn("Speech executor rejected {} request: {}", announcement.tier(), e.getMessage());
                metrics.recordSpeechFailure(announcement.tier(), "executor_rejected");
                staleBefore = previousStaleBefore;
                if (inFlightGeneration == gen) {
                    inFlightTier = previousTier;
                    inFlightGeneration = previousInFlight;
                }
                return null;
            }

            if (announcement.tier() != SpeechTier.INFORMATION) {
                extendSuppression(now.plusMillis(properties.getSuppressionMs()));
            }
            LOG.debug("Accepted {} request #{} interrupt={}", announcement.tier(), gen, announcement.interrupt());
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    private void deliver(Announcement announcement, long gen, Instant acceptedAt, CompletableFuture<Boolean> outcome) {
        boolean spoken = false;
        try {
            if (isStale(gen)) {
                LOG.debug("Skipped stale {} request #{} after interrupt", announcement.tier(), gen);
                return;
            }
            spoken = sink.speak(announcement.text(), announcement.interrupt(), announcement.tier());
            if (spoken) {
                metrics.recordSpoken(announcement.tier());
                publisher.publishEvent(new AnnouncementSpokenEvent(
                        announcement.text(), announcement.tier(), announcement.interrupt(), acceptedAt));
            } else {
                LOG.warn("Speech sink '{}' rejected {} utterance", sink.name(), announcement.tier());
                fail(announcement.tier(), "rejected");
            }
        } catch (RuntimeException e) {
            LOG.warn("Speech sink '{}' failed for {} utterance: {}", sink.name(), announcement.tier(), e.toString());
            fail(announcement.tier(), "error");
        } finally {
            clearInFlight(gen);
            outcome.complete(spoken);
        }
    }

    private void fail(SpeechTier tier, String reason) {
        metrics.recordSpeechFailure(tier, reason);
        publisher.publishEvent(new SpeechFailedEvent(tier, reason, clock.instant()));
    }

    /**
     * Returns {@code true} if requests of the given tier would currently be dropped.
     * Only INFORMATION is ever suppressed.
     */
    public boolean isSuppressed(SpeechTier tier) {
        if (tier != SpeechTier.INFORMATION) {
            return false;
        }
        lock.lock();
        try {
            return isSuppressedAt(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mutes INFORMATION requests for at least the given duration. Never shortens an open window.
     */
    public void suppressInformation(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        lock.lock();
        try {
            extendSuppression(clock.instant().plus(duration));
            LOG.debug("Suppressing INFORMATION speech for {}ms", duration.toMillis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remaining suppression window, or {@link Duration#ZERO} when none is open.
     */
    public Duration remainingSuppression() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return isSuppressedAt(now) ? Duration.between(now, suppressedUntil) : Duration.ZERO;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tier of the most recently accepted request that has not reached the sink yet, or null.
     */
    public SpeechTier inFlight() {
        lock.lock();
        try {
            return inFlightTier;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops playback and drops every request not yet handed to the sink.
     */
    public void stop() {
        lock.lock();
        try {
            staleBefore = generation + 1;
            inFlightTier = null;
        } finally {
            lock.unlock();
        }
        try {
            sink.stop();
        } catch (RuntimeException e) {
            LOG.warn("Speech sink '{}' failed to stop: {}", sink.name(), e.toString());
        }
        LOG.debug("Speech stopped");
    }

    /**
     * Clears the suppression window and drops queued requests. Called on session reset.
     */
    public void reset() {
        lock.lock();
        try {
            suppressedUntil = null;
            inFlightTier = null;
            staleBefore = generation + 1;
            LOG.debug("Speech arbiter reset");
        } finally {
            lock.unlock();
        }
    }

    private boolean isSuppressedAt(Instant now) {
        return suppressedUntil != null && now.isBefore(suppressedUntil);
    }

    private void extendSuppression(Instant until) {
        if (suppressedUntil == null || until.isAfter(suppressedUntil)) {
            suppressedUntil = until;
        }
    }

    private boolean isStale(long gen) {
        lock.lock();
        try {
            return gen < staleBefore;
        } finally {
            lock.unlock();
        }
    }

    private void clearInFlight(long gen) {
        lock.lock();
        try {
            if (inFlightGeneration == gen) {
                inFlightTier = null;
            }
        } finally {
            lock.unlock();
        }
    }
}
