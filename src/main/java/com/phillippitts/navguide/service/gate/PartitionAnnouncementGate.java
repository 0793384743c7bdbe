package com.phillippitts.navguide.service.gate;

import com.phillippitts.navguide.config.properties.GateProperties;
import com.phillippitts.navguide.domain.DecisionResult;
import com.phillippitts.navguide.domain.NavigationDecision;
import com.phillippitts.navguide.service.decision.NavigationPhrases;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.service.speech.SpeechArbiter;
import com.phillippitts.navguide.service.speech.SpeechTier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Announcement gate for the partition decision path.
 *
 * <p>For a decision, evaluated under one lock:
 * <ol>
 *   <li>Hard floor: nothing is spoken within {@code min-inter-speech-ms} of the last announcement</li>
 *   <li>Speak if the object label changed since the last announcement</li>
 *   <li>Otherwise speak only if the repeat interval elapsed (urgent for STOP, non-urgent else)
 *       AND distance or occupancy moved by at least its delta threshold</li>
 * </ol>
 * A missing previous distance or occupancy counts as an infinite delta.
 *
 * <p>Path clear: on entering the clear state "path clear, move straight" is spoken at once
 * (still subject to the floor), then at most once per {@code path-clear-repeat-ms}. Speaking
 * path clear forgets the last spoken label; a frame with obstacles restarts the path-clear cycle.
 *
 * <p>State is recorded only when the arbiter accepted the request. The gate lock is held
 * across the arbiter call so check-then-record is atomic.
 *
 * @since 1.0
 */
public final class PartitionAnnouncementGate {

    private static final Logger LOG = LogManager.getLogger(PartitionAnnouncementGate.class);

    static final String GATE = "partition";

    private final Lock lock = new ReentrantLock();
    private final GateProperties properties;
    private final SpeechArbiter arbiter;
    private final Clock clock;
    private final NavigationMetricsPublisher metrics;

    private Long lastSpeechMillis;
    private DecisionCategory lastDecisionCategory;
    private Double lastSpokenDistance;
    private Double lastSpokenOccupancy;
    private String lastSpokenObjectLabel;
    private Long lastPathClearMillis;

    public PartitionAnnouncementGate(GateProperties properties,
                                     SpeechArbiter arbiter,
                                     Clock clock,
                                     NavigationMetricsPublisher metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? NavigationMetricsPublisher.NOOP : metrics;
    }

    /**
     * Evaluates a fresh decision and speaks it if the gate allows.
     */
    public GateVerdict onDecision(DecisionResult result) {
        Objects.requireNonNull(result, "result");
        lock.lock();
        try {
            long now = clock.millis();
            lastPathClearMillis = null;

            if (withinFloor(now)) {
                LOG.debug("NavSkip: anti-spam floor ({}ms < {}ms) obj={} zone={} occ={}",
                        now - lastSpeechMillis, properties.getMinInterSpeechMs(), result.objectLabel(),
                        result.zoneCoverage().dominantZone(), fmt(result.occupancy()));
                return suppress(SuppressionReason.ANTI_SPAM_FLOOR);
            }

            NavigationDecision decision = result.decision();
            DecisionCategory category = DecisionCategory.of(decision);
            boolean objectChanged = !result.objectLabel().equals(lastSpokenObjectLabel);
            long repeatInterval = NavigationPhrases.isUrgent(decision)
                    ? properties.getUrgentRepeatMs()
                    : properties.getNonurgentRepeatMs();
            boolean timeOk = lastSpeechMillis == null || now - lastSpeechMillis >= repeatInterval;
            boolean distanceOk = delta(result.distanceMeters(), lastSpokenDistance)
                    >= properties.getDistanceDeltaThreshold();
            boolean occupancyOk = delta(result.occupancy(), lastSpokenOccupancy)
                    >= properties.getOccupancyDeltaThreshold();

            if (!objectChanged && !(timeOk && (distanceOk || occupancyOk))) {
                LOG.debug("NavSkip: objChanged=false timeOk={} distOk={} occOk={} obj={} cat={} occ={}",
                        timeOk, distanceOk, occupancyOk, result.objectLabel(), category, fmt(result.occupancy()));
                return suppress(SuppressionReason.NO_MEANINGFUL_CHANGE);
            }

            String text = NavigationPhrases.text(decision, result.objectLabel());
            SpeechTier tier = NavigationPhrases.tierFor(decision);
            if (!arbiter.request(text, tier, tier == SpeechTier.URGENT)) {
                LOG.debug("Navigation speech blocked by arbiter: \"{}\"", text);
                return suppress(SuppressionReason.ARBITER_REJECTED);
            }

            if (objectChanged) {
                LOG.debug("Object changed: {} -> {} (category: {} -> {})",
                        lastSpokenObjectLabel, result.objectLabel(), lastDecisionCategory, category);
            }
            lastSpeechMillis = now;
            lastDecisionCategory = category;
            lastSpokenDistance = result.distanceMeters();
            lastSpokenOccupancy = result.occupancy();
            lastSpokenObjectLabel = result.objectLabel();
            LOG.info("Navigation: \"{}\" [{}] zone={} occ={} dist={}m", text, tier,
                    result.zoneCoverage().dominantZone(), fmt(result.occupancy()), fmt(result.distanceMeters()));
            return GateVerdict.spoken(text);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handles a frame with no qualifying obstacle.
     */
    public GateVerdict onPathClear() {
        lock.lock();
        try {
            long now = clock.millis();
            if (withinFloor(now)) {
                LOG.debug("Path clear skipped: anti-spam floor ({}ms since last speech)", now - lastSpeechMillis);
                return suppress(SuppressionReason.ANTI_SPAM_FLOOR);
            }
            boolean first = lastPathClearMillis == null;
            if (!first && now - lastPathClearMillis < properties.getPathClearRepeatMs()) {
                LOG.debug("Path clear skipped: waiting for interval ({}ms < {}ms)",
                        now - lastPathClearMillis, properties.getPathClearRepeatMs());
                return suppress(SuppressionReason.PATH_CLEAR_INTERVAL);
            }

            if (!arbiter.request(NavigationPhrases.PATH_CLEAR, SpeechTier.NAVIGATION, false)) {
                LOG.debug("Path clear blocked by arbiter [first={}]", first);
                return suppress(SuppressionReason.ARBITER_REJECTED);
            }
            lastPathClearMillis = now;
            lastSpeechMillis = now;
            lastSpokenObjectLabel = null;
            LOG.info("Navigation: \"{}\" [first={}]", NavigationPhrases.PATH_CLEAR, first);
            return GateVerdict.spoken(NavigationPhrases.PATH_CLEAR);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears all gate state. Called on session reset.
     */
    public void reset() {
        lock.lock();
        try {
            lastSpeechMillis = null;
            lastDecisionCategory = null;
            lastSpokenDistance = null;
            lastSpokenOccupancy = null;
            lastSpokenObjectLabel = null;
            lastPathClearMillis = null;
            LOG.debug("Partition announcement gate reset");
        } finally {
            lock.unlock();
        }
    }

    DecisionCategory lastDecisionCategory() {
        lock.lock();
        try {
            return lastDecisionCategory;
        } finally {
            lock.unlock();
        }
    }

    private boolean withinFloor(long now) {
        return lastSpeechMillis != null && now - lastSpeechMillis < properties.getMinInterSpeechMs();
    }

    private GateVerdict suppress(SuppressionReason reason) {
        metrics.recordSuppressed(GATE, reason);
        return GateVerdict.suppress(reason);
    }

    private static double delta(double current, Double previous) {
        return previous == null ? Double.POSITIVE_INFINITY : Math.abs(current - previous);
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
