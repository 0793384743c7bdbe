package com.phillippitts.navguide.service.partition;

import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.PartitionAnalysis;
import com.phillippitts.navguide.domain.Zone;
import com.phillippitts.navguide.domain.ZoneCoverage;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the frame into three equal-width zones and measures how a detection covers them.
 *
 * <p>Works in any consistent horizontal unit (pixels or normalized). With frame width
 * {@code W} and boundaries at {@code W/3} and {@code 2W/3}:
 * <pre>
 * overlaps(LEFT)   = left &lt; W/3
 * overlaps(CENTER) = right &gt; W/3 and left &lt; 2W/3
 * overlaps(RIGHT)  = right &gt; 2W/3
 * </pre>
 * Coverage of a zone is the intersection width divided by the zone width, clamped to [0, 1].
 *
 * <p>Stateless and thread-safe.
 */
public final class PartitionAnalyzer {

    /**
     * Analyzes one detection.
     *
     * @param detection  normalized detection
     * @param frameWidth frame width in the unit of choice (must be positive)
     * @return partition analysis; zero-width boxes yield zero occupancy and a valid center zone
     */
    public PartitionAnalysis analyze(Detection detection, double frameWidth) {
        if (!(frameWidth > 0.0)) {
            throw new IllegalArgumentException("frameWidth must be positive, got: " + frameWidth);
        }
        double centerX = detection.xCenter() * frameWidth;
        double halfWidth = detection.width() * frameWidth / 2.0;
        double left = centerX - halfWidth;
        double right = centerX + halfWidth;

        double leftBoundary = frameWidth / 3.0;
        double rightBoundary = frameWidth * 2.0 / 3.0;

        Set<Zone> overlaps = EnumSet.noneOf(Zone.class);
        if (left < leftBoundary) {
            overlaps.add(Zone.LEFT);
        }
        if (right > leftBoundary && left < rightBoundary) {
            overlaps.add(Zone.CENTER);
        }
        if (right > rightBoundary) {
            overlaps.add(Zone.RIGHT);
        }

        double midpoint = (left + right) / 2.0;
        Zone centerZone;
        if (midpoint < leftBoundary) {
            centerZone = Zone.LEFT;
        } else if (midpoint < rightBoundary) {
            centerZone = Zone.CENTER;
        } else {
            centerZone = Zone.RIGHT;
        }

        double zoneWidth = frameWidth / 3.0;
        ZoneCoverage coverage = new ZoneCoverage(
                coverage(left, right, 0.0, leftBoundary, zoneWidth),
                coverage(left, right, leftBoundary, rightBoundary, zoneWidth),
                coverage(left, right, rightBoundary, frameWidth, zoneWidth));

        return new PartitionAnalysis(detection, overlaps, centerZone, (right - left) / frameWidth, coverage);
    }

    public List<PartitionAnalysis> analyzeAll(List<Detection> detections, double frameWidth) {
        return detections.stream()
                .map(d -> analyze(d, frameWidth))
                .toList();
    }

    private static double coverage(double left, double right, double zoneStart, double zoneEnd, double zoneWidth) {
        double intersection = Math.min(right, zoneEnd) - Math.max(left, zoneStart);
        if (intersection <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, intersection / zoneWidth);
    }
}
