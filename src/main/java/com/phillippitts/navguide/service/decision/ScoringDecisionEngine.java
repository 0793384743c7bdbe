package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.config.properties.LegacyProperties;
import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.Direction;
import com.phillippitts.navguide.domain.DistanceCategory;
import com.phillippitts.navguide.domain.Guidance;
import com.phillippitts.navguide.service.detection.DepthCalibration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateless ranking function of the legacy scoring path.
 *
 * <p>Filters by confidence, lower-frame position, minimum width and a label stoplist, then
 * scores each survivor:
 * <pre>
 * priority = confidence * 2 + distanceTerm * 3 + (CENTER ? 4 : 1)
 * distanceTerm = 10 / clamp(meters, 0.1, 10), or 0.5 without a distance
 * </pre>
 * The highest priority wins; the first detection wins ties.
 */
public final class ScoringDecisionEngine {

    private static final Logger LOG = LogManager.getLogger(ScoringDecisionEngine.class);

    static final double CONFIDENCE_WEIGHT = 2.0;
    static final double DISTANCE_WEIGHT = 3.0;
    static final double CENTER_WEIGHT = 4.0;
    static final double SIDE_WEIGHT = 1.0;
    static final double UNKNOWN_DISTANCE_TERM = 0.5;

    private final LegacyProperties properties;
    private final DepthCalibration calibration;

    public ScoringDecisionEngine(LegacyProperties properties, DepthCalibration calibration) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.calibration = Objects.requireNonNull(calibration, "calibration");
    }

    public Optional<ScoredGuidance> analyze(List<Detection> detections) {
        ScoredGuidance best = null;
        for (Detection d : detections) {
            if (!include(d)) {
                continue;
            }
            Direction direction = direction(d.xCenter());
            Guidance guidance = new Guidance(d.label(), direction, category(d), priority(d, direction));
            if (best == null || guidance.priority() > best.guidance().priority()) {
                best = new ScoredGuidance(guidance, d);
            }
        }
        if (best != null) {
            LOG.debug("Top guidance: {} {} {} priority={}", best.guidance().label(), best.guidance().direction(),
                    best.guidance().distance(), best.guidance().priority());
        }
        return Optional.ofNullable(best);
    }

    boolean include(Detection d) {
        if (d.confidence() < properties.getMinConfidence()) {
            return false;
        }
        if (d.yCenter() < properties.getMinYCenter()) {
            return false;
        }
        if (d.width() < properties.getMinWidth()) {
            return false;
        }
        String label = d.label().trim().toLowerCase(Locale.ROOT);
        return properties.getStoplist().stream().noneMatch(label::contains);
    }

    Direction direction(double xCenter) {
        if (xCenter < properties.getLeftBoundary()) {
            return Direction.LEFT;
        }
        if (xCenter > properties.getRightBoundary()) {
            return Direction.RIGHT;
        }
        return Direction.CENTER;
    }

    /**
     * Category from metric distance when present, else from width when the fallback is
     * enabled, else FAR.
     */
    DistanceCategory category(Detection d) {
        if (d.hasDistance()) {
            return calibration.category(d.distanceMeters());
        }
        if (!properties.isWidthFallbackEnabled()) {
            return DistanceCategory.FAR;
        }
        double score = Math.pow(1.0 - d.width(), 4);
        if (score < 0.10) {
            return DistanceCategory.VERY_CLOSE;
        }
        if (score < 0.30) {
            return DistanceCategory.CLOSE;
        }
        if (score < 0.60) {
            return DistanceCategory.MEDIUM;
        }
        return DistanceCategory.FAR;
    }

    static double priority(Detection d, Direction direction) {
        double distanceTerm = d.hasDistance()
                ? 10.0 / Math.max(0.1, Math.min(10.0, d.distanceMeters()))
                : UNKNOWN_DISTANCE_TERM;
        double directionWeight = direction == Direction.CENTER ? CENTER_WEIGHT : SIDE_WEIGHT;
        return d.confidence() * CONFIDENCE_WEIGHT + distanceTerm * DISTANCE_WEIGHT + directionWeight;
    }
}
