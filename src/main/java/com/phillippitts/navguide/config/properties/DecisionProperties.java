package com.phillippitts.navguide.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the partition decision path and strategy selection.
 */
@Validated
@ConfigurationProperties(prefix = "nav.decision")
public class DecisionProperties {

    public enum Strategy { PARTITION, LEGACY }

    @NotNull
    private final Strategy strategy;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minConfidence;

    /** Detections farther than this (meters) are ignored by the partition path. */
    @Positive
    private final double navigationDistanceThreshold;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double fullBlockThreshold;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double largeObjectThreshold;

    @Positive
    private final double stopDistance;

    @Positive
    private final double alertDistance;

    @ConstructorBinding
    public DecisionProperties(Strategy strategy,
                              Double minConfidence,
                              Double navigationDistanceThreshold,
                              Double fullBlockThreshold,
                              Double largeObjectThreshold,
                              Double stopDistance,
                              Double alertDistance) {
        this.strategy = strategy == null ? Strategy.PARTITION : strategy;
        this.minConfidence = minConfidence == null ? 0.40 : minConfidence;
        this.navigationDistanceThreshold = navigationDistanceThreshold == null ? 3.5 : navigationDistanceThreshold;
        this.fullBlockThreshold = fullBlockThreshold == null ? 0.60 : fullBlockThreshold;
        this.largeObjectThreshold = largeObjectThreshold == null ? 0.40 : largeObjectThreshold;
        this.stopDistance = stopDistance == null ? 1.0 : stopDistance;
        this.alertDistance = alertDistance == null ? 2.5 : alertDistance;

        if (this.largeObjectThreshold > this.fullBlockThreshold) {
            throw new IllegalArgumentException("nav.decision.large-object-threshold (" + this.largeObjectThreshold
                    + ") must not exceed full-block-threshold (" + this.fullBlockThreshold + ")");
        }
        if (this.stopDistance > this.alertDistance) {
            throw new IllegalArgumentException("nav.decision.stop-distance (" + this.stopDistance
                    + ") must not exceed alert-distance (" + this.alertDistance + ")");
        }
    }

    /**
     * Properties with every value at its default.
     */
    public static DecisionProperties defaults() {
        return new DecisionProperties(null, null, null, null, null, null, null);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getNavigationDistanceThreshold() {
        return navigationDistanceThreshold;
    }

    public double getFullBlockThreshold() {
        return fullBlockThreshold;
    }

    public double getLargeObjectThreshold() {
        return largeObjectThreshold;
    }

    public double getStopDistance() {
        return stopDistance;
    }

    public double getAlertDistance() {
        return alertDistance;
    }
}
