package com.phillippitts.navguide.service.speech;

import com.phillippitts.navguide.config.properties.SpeechProperties;
import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.service.gate.GateVerdict;
import com.phillippitts.navguide.service.gate.SuppressionReason;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * INFORMATION-tier producer that narrates the single closest object,
 * e.g. {@code "chair, about 1.8 meters to your left"}.
 *
 * <p>Per frame: pick the closest detection with a distance (first wins ties), smooth its
 * distance with an EMA, then speak only if the cooldown has elapsed and either the label
 * changed or the smoothed distance moved by more than the change threshold. The arbiter's
 * suppression window mutes the narrator while navigation guidance is speaking.
 *
 * <p>Thread-safe; one lock guards all state. Lock order: narrator, then arbiter.
 */
public final class ClosestObjectNarrator {

    private static final Logger LOG = LogManager.getLogger(ClosestObjectNarrator.class);

    private static final String GATE = "narrator";

    private final Lock lock = new ReentrantLock();
    private final SpeechProperties properties;
    private final SpeechArbiter arbiter;
    private final Clock clock;
    private final NavigationMetricsPublisher metrics;
    private final ExponentialSmoother smoother;

    private String lastSpokenLabel;
    private Double lastSpokenDistance;
    private Long lastSpeechMillis;

    public ClosestObjectNarrator(SpeechProperties properties,
                                 SpeechArbiter arbiter,
                                 Clock clock,
                                 NavigationMetricsPublisher metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? NavigationMetricsPublisher.NOOP : metrics;
        this.smoother = new ExponentialSmoother(properties.getNarratorEmaAlpha());
    }

    /**
     * Considers one frame's detections for narration.
     *
     * @return verdict; suppressed with {@link SuppressionReason#NO_CANDIDATE} when no
     *         detection qualifies
     */
    public GateVerdict process(List<Detection> detections) {
        Detection closest = closest(detections);
        if (closest == null) {
            return GateVerdict.suppress(SuppressionReason.NO_CANDIDATE);
        }

        lock.lock();
        try {
            double smoothed = smoother.smooth(closest.distanceMeters());
            long now = clock.millis();

            if (lastSpeechMillis != null && now - lastSpeechMillis < properties.getNarratorCooldownMs()) {
                return suppress(SuppressionReason.NARRATOR_COOLDOWN);
            }

            boolean labelChanged = !closest.label().equals(lastSpokenLabel);
            boolean distanceChanged = lastSpokenDistance == null
                    || Math.abs(smoothed - lastSpokenDistance) > properties.getNarratorDistanceChangeThreshold();
            if (!labelChanged && !distanceChanged) {
                LOG.debug("Narration skipped: {} still at ~{}m", closest.label(), format(smoothed));
                return suppress(SuppressionReason.NARRATOR_HYSTERESIS);
            }

            if (arbiter.isSuppressed(SpeechTier.INFORMATION)) {
                return suppress(SuppressionReason.INFORMATION_SUPPRESSED);
            }

            String text = String.format(Locale.ROOT, "%s, about %.1f meters %s",
                    closest.label(), smoothed, direction(closest.xCenter()));
            if (!arbiter.request(text, SpeechTier.INFORMATION, false)) {
                return suppress(SuppressionReason.ARBITER_REJECTED);
            }

            lastSpokenLabel = closest.label();
            lastSpokenDistance = smoothed;
            lastSpeechMillis = now;
            LOG.debug("Narrated closest object: \"{}\" [raw={}m]", text, format(closest.distanceMeters()));
            return GateVerdict.spoken(text);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            smoother.reset();
            lastSpokenLabel = null;
            lastSpokenDistance = null;
            lastSpeechMillis = null;
        } finally {
            lock.unlock();
        }
    }

    private Detection closest(List<Detection> detections) {
        Detection best = null;
        for (Detection d : detections) {
            if (d.confidence() < properties.getNarratorMinConfidence() || !d.hasDistance()) {
                continue;
            }
            if (best == null || d.distanceMeters() < best.distanceMeters()) {
                best = d;
            }
        }
        return best;
    }

    private GateVerdict suppress(SuppressionReason reason) {
        metrics.recordSuppressed(GATE, reason);
        return GateVerdict.suppress(reason);
    }

    static String direction(double xCenter) {
        if (xCenter < 1.0 / 3.0) {
            return "to your left";
        }
        if (xCenter > 2.0 / 3.0) {
            return "to your right";
        }
        return "ahead";
    }

    private static String format(double meters) {
        return String.format(Locale.ROOT, "%.2f", meters);
    }
}
