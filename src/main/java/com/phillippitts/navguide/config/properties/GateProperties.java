package com.phillippitts.navguide.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Timing and hysteresis settings for the partition announcement gate.
 */
@Validated
@ConfigurationProperties(prefix = "nav.gate")
public class GateProperties {

    /** Repeat interval for STOP decisions. */
    @Min(0)
    private final long urgentRepeatMs;

    /** Repeat interval for lateral and straight decisions. */
    @Min(0)
    private final long nonurgentRepeatMs;

    /** Hard floor between any two announcements, checked before everything else. */
    @Min(0)
    private final long minInterSpeechMs;

    @Min(0)
    private final long pathClearRepeatMs;

    @PositiveOrZero
    private final double distanceDeltaThreshold;

    @PositiveOrZero
    private final double occupancyDeltaThreshold;

    @ConstructorBinding
    public GateProperties(Long urgentRepeatMs,
                          Long nonurgentRepeatMs,
                          Long minInterSpeechMs,
                          Long pathClearRepeatMs,
                          Double distanceDeltaThreshold,
                          Double occupancyDeltaThreshold) {
        this.urgentRepeatMs = urgentRepeatMs == null ? 1200L : urgentRepeatMs;
        this.nonurgentRepeatMs = nonurgentRepeatMs == null ? 5000L : nonurgentRepeatMs;
        this.minInterSpeechMs = minInterSpeechMs == null ? 2000L : minInterSpeechMs;
        this.pathClearRepeatMs = pathClearRepeatMs == null ? 8000L : pathClearRepeatMs;
        this.distanceDeltaThreshold = distanceDeltaThreshold == null ? 0.5 : distanceDeltaThreshold;
        this.occupancyDeltaThreshold = occupancyDeltaThreshold == null ? 0.10 : occupancyDeltaThreshold;
    }

    public static GateProperties defaults() {
        return new GateProperties(null, null, null, null, null, null);
    }

    public long getUrgentRepeatMs() {
        return urgentRepeatMs;
    }

    public long getNonurgentRepeatMs() {
        return nonurgentRepeatMs;
    }

    public long getMinInterSpeechMs() {
        return minInterSpeechMs;
    }

    public long getPathClearRepeatMs() {
        return pathClearRepeatMs;
    }

    public double getDistanceDeltaThreshold() {
        return distanceDeltaThreshold;
    }

    public double getOccupancyDeltaThreshold() {
        return occupancyDeltaThreshold;
    }
}
