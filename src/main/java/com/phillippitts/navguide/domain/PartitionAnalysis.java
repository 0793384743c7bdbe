package com.phillippitts.navguide.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Spatial breakdown of one detection across the three frame zones.
 *
 * <p>Derived from a {@link Detection} every frame and never persisted.
 *
 * @param detection        the analyzed detection
 * @param overlaps         zones the bounding box intersects
 * @param centerZone       zone containing the horizontal midpoint of the box
 * @param overallOccupancy box width divided by frame width
 * @param zoneCoverage     per-zone covered fraction
 */
public record PartitionAnalysis(
        Detection detection,
        Set<Zone> overlaps,
        Zone centerZone,
        double overallOccupancy,
        ZoneCoverage zoneCoverage
) {

    public PartitionAnalysis {
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(centerZone, "centerZone");
        Objects.requireNonNull(zoneCoverage, "zoneCoverage");
        overlaps = Set.copyOf(overlaps);
    }

    public boolean overlaps(Zone zone) {
        return overlaps.contains(zone);
    }
}
