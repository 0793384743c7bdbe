package com.phillippitts.navguide.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Depth calibration: relative depth to meters, and meters to distance category.
 */
@Validated
@ConfigurationProperties(prefix = "nav.depth")
public class DepthProperties {

    /** Relative depth is divided by this value to obtain meters. */
    @Positive
    private final double scaleFactor;

    @Positive
    private final double minMeters;

    @Positive
    private final double maxMeters;

    @Positive
    private final double veryCloseThreshold;

    @Positive
    private final double closeThreshold;

    @Positive
    private final double mediumThreshold;

    @ConstructorBinding
    public DepthProperties(Double scaleFactor,
                           Double minMeters,
                           Double maxMeters,
                           Double veryCloseThreshold,
                           Double closeThreshold,
                           Double mediumThreshold) {
        this.scaleFactor = scaleFactor == null ? 150.0 : scaleFactor;
        this.minMeters = minMeters == null ? 0.1 : minMeters;
        this.maxMeters = maxMeters == null ? 10.0 : maxMeters;
        this.veryCloseThreshold = veryCloseThreshold == null ? 1.0 : veryCloseThreshold;
        this.closeThreshold = closeThreshold == null ? 2.0 : closeThreshold;
        this.mediumThreshold = mediumThreshold == null ? 4.0 : mediumThreshold;

        if (this.minMeters >= this.maxMeters) {
            throw new IllegalArgumentException("nav.depth.min-meters (" + this.minMeters
                    + ") must be below max-meters (" + this.maxMeters + ")");
        }
        if (!(this.veryCloseThreshold < this.closeThreshold && this.closeThreshold < this.mediumThreshold)) {
            throw new IllegalArgumentException("nav.depth thresholds must be strictly increasing: very-close="
                    + this.veryCloseThreshold + ", close=" + this.closeThreshold + ", medium=" + this.mediumThreshold);
        }
    }

    public static DepthProperties defaults() {
        return new DepthProperties(null, null, null, null, null, null);
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public double getMinMeters() {
        return minMeters;
    }

    public double getMaxMeters() {
        return maxMeters;
    }

    public double getVeryCloseThreshold() {
        return veryCloseThreshold;
    }

    public double getCloseThreshold() {
        return closeThreshold;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }
}
