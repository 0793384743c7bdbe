package com.phillippitts.navguide.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the navigation pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Per-frame pipeline latency per strategy</li>
 *   <li>Spoken announcements per producer and tier</li>
 *   <li>Suppressions per gate and rule</li>
 *   <li>Speech sink failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class NavigationMetrics {

    private static final String METRIC_PREFIX = "navguide";

    private final MeterRegistry registry;

    public NavigationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the time one frame spent in the pipeline.
     *
     * @param strategy      active strategy name (partition, legacy)
     * @param durationNanos duration in nanoseconds
     */
    public void recordFrameLatency(String strategy, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".frame.latency")
                .description("Time taken to process one detection frame")
                .tag("strategy", strategy)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts an utterance accepted by the speech sink.
     *
     * @param tier speech tier name
     */
    public void incrementSpoken(String tier) {
        Counter.builder(METRIC_PREFIX + ".announcement.spoken")
                .description("Number of utterances accepted by the speech sink")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    /**
     * Counts a suppressed announcement.
     *
     * @param gate   component that suppressed (partition, legacy, arbiter, narrator)
     * @param reason suppression rule
     */
    public void incrementSuppressed(String gate, String reason) {
        Counter.builder(METRIC_PREFIX + ".suppressed")
                .description("Number of announcements suppressed by a gate or the arbiter")
                .tag("gate", gate)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSpeechFailure(String tier, String reason) {
        Counter.builder(METRIC_PREFIX + ".announcement.failure")
                .description("Number of utterances the speech sink rejected or failed")
                .tag("tier", tier)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
