package com.phillippitts.navguide.service.gate;

import com.phillippitts.navguide.config.properties.LegacyProperties;
import com.phillippitts.navguide.domain.Direction;
import com.phillippitts.navguide.domain.DistanceCategory;
import com.phillippitts.navguide.domain.Guidance;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rate limiter for the legacy scoring path, keyed by label and by label plus direction.
 *
 * <p>Rules, evaluated in order (first failing rule suppresses):
 * <ol>
 *   <li>Global cooldown since any announcement</li>
 *   <li>FAR is never announced</li>
 *   <li>MEDIUM only when CENTER and priority above the medium threshold</li>
 *   <li>Bounding box narrower than the minimum announce width</li>
 *   <li>Horizontal center within the edge margin of either frame edge</li>
 *   <li>Per-label cooldown</li>
 *   <li>Per-label-and-direction cooldown</li>
 *   <li>Movement sensitivity: with a recorded category for the label, only a strictly more
 *       dangerous category passes</li>
 * </ol>
 *
 * <p>One lock guards all four maps. {@link #tryAcquire} checks and records in a single
 * critical section, so two threads can never both pass the same cooldown window.
 *
 * @since 1.0
 */
public final class WarningRateLimiter {

    private static final Logger LOG = LogManager.getLogger(WarningRateLimiter.class);

    static final String GATE = "legacy";

    private final Lock lock = new ReentrantLock();
    private final LegacyProperties properties;
    private final Clock clock;
    private final NavigationMetricsPublisher metrics;

    private Long lastGlobalMillis;
    private final Map<String, Long> perLabelMillis = new HashMap<>();
    private final Map<LabelDirection, Long> perLabelDirectionMillis = new HashMap<>();
    private final Map<String, DistanceCategory> lastCategoryByLabel = new HashMap<>();

    public WarningRateLimiter(LegacyProperties properties, Clock clock, NavigationMetricsPublisher metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? NavigationMetricsPublisher.NOOP : metrics;
    }

    /**
     * Evaluates the rules without recording anything.
     *
     * @param guidance candidate guidance
     * @param width    normalized bounding-box width of the underlying detection
     * @param xCenter  normalized horizontal center of the underlying detection
     */
    public GateVerdict evaluate(Guidance guidance, double width, double xCenter) {
        Objects.requireNonNull(guidance, "guidance");
        lock.lock();
        try {
            return check(guidance, width, xCenter, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluates the rules and, if they pass, records the announcement in the same critical section.
     */
    public GateVerdict tryAcquire(Guidance guidance, double width, double xCenter) {
        Objects.requireNonNull(guidance, "guidance");
        lock.lock();
        try {
            long now = clock.millis();
            GateVerdict verdict = check(guidance, width, xCenter, now);
            if (verdict.allowed()) {
                recordAt(guidance, now);
            } else {
                metrics.recordSuppressed(GATE, verdict.reason());
            }
            return verdict;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an announcement made for the guidance, updating every timer and the category.
     */
    public void record(Guidance guidance) {
        Objects.requireNonNull(guidance, "guidance");
        lock.lock();
        try {
            recordAt(guidance, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    private GateVerdict check(Guidance guidance, double width, double xCenter, long now) {
        if (lastGlobalMillis != null && now - lastGlobalMillis < properties.getGlobalCooldownMs()) {
            LOG.debug("SUPPRESSED: global cooldown ({}ms remaining)",
                    properties.getGlobalCooldownMs() - (now - lastGlobalMillis));
            return GateVerdict.suppress(SuppressionReason.GLOBAL_COOLDOWN);
        }

        if (guidance.distance() == DistanceCategory.FAR) {
            LOG.debug("SUPPRESSED: FAR distance ({})", guidance.label());
            return GateVerdict.suppress(SuppressionReason.FAR_DISTANCE);
        }

        if (guidance.distance() == DistanceCategory.MEDIUM
                && !(guidance.direction() == Direction.CENTER
                        && guidance.priority() > properties.getMediumPriorityThreshold())) {
            LOG.debug("SUPPRESSED: MEDIUM {} {} priority={}", guidance.label(), guidance.direction(),
                    guidance.priority());
            return GateVerdict.suppress(SuppressionReason.MEDIUM_NOT_CRITICAL);
        }

        if (width < properties.getMinAnnounceWidth()) {
            return GateVerdict.suppress(SuppressionReason.TOO_SMALL);
        }

        double edge = properties.getEdgeThreshold();
        if (xCenter < edge || xCenter > 1.0 - edge) {
            return GateVerdict.suppress(SuppressionReason.FRAME_EDGE);
        }

        Long lastForLabel = perLabelMillis.get(guidance.label());
        if (lastForLabel != null && now - lastForLabel < properties.getPerObjectCooldownMs()) {
            LOG.debug("SUPPRESSED: per-object cooldown for '{}' ({}ms remaining)", guidance.label(),
                    properties.getPerObjectCooldownMs() - (now - lastForLabel));
            return GateVerdict.suppress(SuppressionReason.OBJECT_COOLDOWN);
        }

        Long lastForDirection = perLabelDirectionMillis.get(new LabelDirection(guidance.label(), guidance.direction()));
        if (lastForDirection != null && now - lastForDirection < properties.getDirectionalCooldownMs()) {
            return GateVerdict.suppress(SuppressionReason.DIRECTIONAL_COOLDOWN);
        }

        DistanceCategory previous = lastCategoryByLabel.get(guidance.label());
        if (previous != null && !guidance.distance().isMoreDangerousThan(previous)) {
            LOG.debug("SUPPRESSED: {} not closer than before ({} -> {})", guidance.label(), previous,
                    guidance.distance());
            return GateVerdict.suppress(SuppressionReason.NOT_MORE_DANGEROUS);
        }

        LOG.debug("ALLOWED: {} {} {}", guidance.label(), guidance.distance(), guidance.direction());
        return GateVerdict.allow();
    }

    private void recordAt(Guidance guidance, long now) {
        lastGlobalMillis = now;
        perLabelMillis.put(guidance.label(), now);
        perLabelDirectionMillis.put(new LabelDirection(guidance.label(), guidance.direction()), now);
        lastCategoryByLabel.put(guidance.label(), guidance.distance());
    }

    /**
     * Remaining per-object cooldown for a label in milliseconds, 0 when none is active.
     */
    public long remainingCooldownMs(String label) {
        lock.lock();
        try {
            Long last = perLabelMillis.get(label);
            if (last == null) {
                return 0L;
            }
            return Math.max(0L, properties.getPerObjectCooldownMs() - (clock.millis() - last));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time copy of the limiter state for diagnostics.
     */
    public Snapshot debugSnapshot() {
        lock.lock();
        try {
            long now = clock.millis();
            long global = lastGlobalMillis == null
                    ? 0L
                    : Math.max(0L, properties.getGlobalCooldownMs() - (now - lastGlobalMillis));
            Map<String, Long> remaining = new TreeMap<>();
            perLabelMillis.forEach((label, t) ->
                    remaining.put(label, Math.max(0L, properties.getPerObjectCooldownMs() - (now - t))));
            return new Snapshot(global, remaining, new TreeMap<>(lastCategoryByLabel));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears all timers and tracked categories. Called on session reset.
     */
    public void reset() {
        lock.lock();
        try {
            lastGlobalMillis = null;
            perLabelMillis.clear();
            perLabelDirectionMillis.clear();
            lastCategoryByLabel.clear();
            LOG.debug("Warning rate limiter reset");
        } finally {
            lock.unlock();
        }
    }

    private record LabelDirection(String label, Direction direction) {}

    /**
     * Diagnostic view of the limiter.
     *
     * @param globalRemainingMs    remaining global cooldown
     * @param objectRemainingMs    remaining per-object cooldown by label
     * @param lastCategoryByLabel  last announced category by label
     */
    public record Snapshot(long globalRemainingMs,
                           Map<String, Long> objectRemainingMs,
                           Map<String, DistanceCategory> lastCategoryByLabel) {

        public Snapshot {
            objectRemainingMs = Map.copyOf(objectRemainingMs);
            lastCategoryByLabel = Map.copyOf(lastCategoryByLabel);
        }
    }
}
