package com.phillippitts.navguide.service.metrics;

import com.phillippitts.navguide.service.gate.SuppressionReason;
import com.phillippitts.navguide.service.speech.SpeechTier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link NavigationMetrics} used by gates, the arbiter and the session.
 *
 * <p>Components built directly in tests receive {@link #NOOP}, so none of them needs a
 * {@link io.micrometer.core.instrument.MeterRegistry}.
 *
 * @see NavigationMetrics
 */
@Component
public final class NavigationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(NavigationMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and directly constructed components.
     */
    public static final NavigationMetricsPublisher NOOP = new NavigationMetricsPublisher(null);

    private final NavigationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public NavigationMetricsPublisher(NavigationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("NavigationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordFrame(String strategy, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordFrameLatency(strategy, durationNanos);
    }

    public void recordSpoken(SpeechTier tier) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSpoken(tier.name());
    }

    public void recordSuppressed(String gate, SuppressionReason reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSuppressed(gate, reason.name());
    }

    public void recordSpeechFailure(SpeechTier tier, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSpeechFailure(tier.name(), reason);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
