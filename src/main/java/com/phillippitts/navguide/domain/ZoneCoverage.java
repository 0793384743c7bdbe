package com.phillippitts.navguide.domain;

/**
 * Fraction of each zone's width covered by a bounding box, each in [0, 1].
 */
public record ZoneCoverage(double leftPct, double centerPct, double rightPct) {

    public static final ZoneCoverage NONE = new ZoneCoverage(0.0, 0.0, 0.0);

    public double of(Zone zone) {
        return switch (zone) {
            case LEFT -> leftPct;
            case CENTER -> centerPct;
            case RIGHT -> rightPct;
        };
    }

    /**
     * Zone with the highest coverage; LEFT wins ties, then CENTER. Used in log lines.
     */
    public Zone dominantZone() {
        if (leftPct >= centerPct && leftPct >= rightPct) {
            return Zone.LEFT;
        }
        return centerPct >= rightPct ? Zone.CENTER : Zone.RIGHT;
    }
}
