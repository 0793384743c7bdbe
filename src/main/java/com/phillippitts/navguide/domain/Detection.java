package com.phillippitts.navguide.domain;

import java.util.Objects;

/**
 * Canonical per-frame detection with geometry normalized to the frame.
 *
 * <p>All geometry is expressed as fractions of the frame: {@code xCenter} and {@code yCenter}
 * locate the bounding-box center (0.0 = left/top, 1.0 = right/bottom), {@code width} and
 * {@code height} are the box extent. Instances are produced by
 * {@link com.phillippitts.navguide.service.detection.DetectionNormalizer}, which clamps raw
 * detector output into these ranges; downstream components assume the ranges hold.
 *
 * @param label          detector class label (never null)
 * @param confidence     detector score between 0.0 and 1.0
 * @param xCenter        normalized horizontal center
 * @param yCenter        normalized vertical center
 * @param width          normalized bounding-box width
 * @param height         normalized bounding-box height
 * @param distanceMeters metric distance from depth estimation, or {@code null} when unknown
 */
public record Detection(
        String label,
        double confidence,
        double xCenter,
        double yCenter,
        double width,
        double height,
        Double distanceMeters
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if label is null
     * @throws IllegalArgumentException if confidence or geometry is outside [0, 1]
     */
    public Detection {
        Objects.requireNonNull(label, "Detection label must not be null");
        requireUnit("confidence", confidence);
        requireUnit("xCenter", xCenter);
        requireUnit("yCenter", yCenter);
        requireUnit("width", width);
        requireUnit("height", height);
        if (distanceMeters != null && (distanceMeters.isNaN() || distanceMeters < 0.0)) {
            throw new IllegalArgumentException("distanceMeters must be a non-negative number, got: "
                    + distanceMeters);
        }
    }

    /**
     * Returns {@code true} when depth estimation produced a distance for this detection.
     */
    public boolean hasDistance() {
        return distanceMeters != null;
    }

    /**
     * Returns a copy of this detection carrying the given distance.
     *
     * @param meters distance in meters (nullable)
     * @return new detection with identical geometry
     */
    public Detection withDistance(Double meters) {
        return new Detection(label, confidence, xCenter, yCenter, width, height, meters);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got: " + value);
        }
    }
}
