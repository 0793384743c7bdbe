package com.phillippitts.navguide.service.detection;

import com.phillippitts.navguide.config.properties.DepthProperties;
import com.phillippitts.navguide.domain.DistanceCategory;

import java.util.Objects;

/**
 * Converts depth-model output to meters and meters to a {@link DistanceCategory}.
 *
 * <p>Formula: {@code meters = relativeDepth / scaleFactor}, clamped to
 * {@code [minMeters, maxMeters]}. Category thresholds are exclusive upper bounds:
 * a value equal to the close threshold is MEDIUM, not CLOSE.
 */
public final class DepthCalibration {

    private final DepthProperties properties;

    public DepthCalibration(DepthProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Converts a relative depth value to clamped meters.
     *
     * @param relativeDepth median relative depth over the detection region
     * @return meters, or {@code null} when the value is not a usable depth (NaN, infinite, negative)
     */
    public Double toMeters(double relativeDepth) {
        if (!Double.isFinite(relativeDepth) || relativeDepth < 0.0) {
            return null;
        }
        return clampMeters(relativeDepth / properties.getScaleFactor());
    }

    /**
     * Clamps an already metric distance into the configured range.
     *
     * @return clamped meters, or {@code null} for NaN or infinite input
     */
    public Double clampMeters(double meters) {
        if (!Double.isFinite(meters)) {
            return null;
        }
        return Math.max(properties.getMinMeters(), Math.min(properties.getMaxMeters(), meters));
    }

    public DistanceCategory category(double meters) {
        if (meters < properties.getVeryCloseThreshold()) {
            return DistanceCategory.VERY_CLOSE;
        }
        if (meters < properties.getCloseThreshold()) {
            return DistanceCategory.CLOSE;
        }
        if (meters < properties.getMediumThreshold()) {
            return DistanceCategory.MEDIUM;
        }
        return DistanceCategory.FAR;
    }
}
