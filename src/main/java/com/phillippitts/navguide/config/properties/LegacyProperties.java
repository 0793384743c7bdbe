package com.phillippitts.navguide.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Filtering, scoring and rate-limit settings for the legacy scoring path.
 *
 * <p>Deliberately independent from {@link DecisionProperties}: both paths carry their own
 * confidence threshold even though the defaults coincide.
 */
@Validated
@ConfigurationProperties(prefix = "nav.legacy")
public class LegacyProperties {

    public static final List<String> DEFAULT_STOPLIST = List.of(
            "book", "bottle", "cup", "keyboard", "mouse",
            "laptop", "charger", "cell phone", "remote");

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minConfidence;

    /** Only objects in the lower part of the frame (the path ahead) are considered. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minYCenter;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minWidth;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double leftBoundary;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double rightBoundary;

    @NotNull
    private final List<String> stoplist;

    private final boolean widthFallbackEnabled;

    @Min(0)
    private final long globalCooldownMs;

    @Min(0)
    private final long perObjectCooldownMs;

    @Min(0)
    private final long directionalCooldownMs;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minAnnounceWidth;

    @DecimalMin("0.0")
    @DecimalMax("0.5")
    private final double edgeThreshold;

    /** MEDIUM objects are announced only when centered and scored above this value. */
    private final double mediumPriorityThreshold;

    @ConstructorBinding
    public LegacyProperties(Double minConfidence,
                            Double minYCenter,
                            Double minWidth,
                            Double leftBoundary,
                            Double rightBoundary,
                            List<String> stoplist,
                            Boolean widthFallbackEnabled,
                            Long globalCooldownMs,
                            Long perObjectCooldownMs,
                            Long directionalCooldownMs,
                            Double minAnnounceWidth,
                            Double edgeThreshold,
                            Double mediumPriorityThreshold) {
        this.minConfidence = minConfidence == null ? 0.40 : minConfidence;
        this.minYCenter = minYCenter == null ? 0.5 : minYCenter;
        this.minWidth = minWidth == null ? 0.05 : minWidth;
        this.leftBoundary = leftBoundary == null ? 0.33 : leftBoundary;
        this.rightBoundary = rightBoundary == null ? 0.66 : rightBoundary;
        this.stoplist = stoplist == null
                ? DEFAULT_STOPLIST
                : stoplist.stream()
                        .filter(s -> s != null && !s.isBlank())
                        .map(s -> s.trim().toLowerCase(Locale.ROOT))
                        .toList();
        this.widthFallbackEnabled = widthFallbackEnabled == null || widthFallbackEnabled;
        this.globalCooldownMs = globalCooldownMs == null ? 2500L : globalCooldownMs;
        this.perObjectCooldownMs = perObjectCooldownMs == null ? 5000L : perObjectCooldownMs;
        this.directionalCooldownMs = directionalCooldownMs == null ? 3000L : directionalCooldownMs;
        this.minAnnounceWidth = minAnnounceWidth == null ? 0.08 : minAnnounceWidth;
        this.edgeThreshold = edgeThreshold == null ? 0.05 : edgeThreshold;
        this.mediumPriorityThreshold = mediumPriorityThreshold == null ? 10.0 : mediumPriorityThreshold;

        if (this.leftBoundary >= this.rightBoundary) {
            throw new IllegalArgumentException("nav.legacy.left-boundary (" + this.leftBoundary
                    + ") must be below right-boundary (" + this.rightBoundary + ")");
        }
    }

    public static LegacyProperties defaults() {
        return new LegacyProperties(null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getMinYCenter() {
        return minYCenter;
    }

    public double getMinWidth() {
        return minWidth;
    }

    public double getLeftBoundary() {
        return leftBoundary;
    }

    public double getRightBoundary() {
        return rightBoundary;
    }

    /**
     * Lower-cased stoplist entries. A label is ignored when it contains any entry.
     */
    public List<String> getStoplist() {
        return stoplist;
    }

    public boolean isWidthFallbackEnabled() {
        return widthFallbackEnabled;
    }

    public long getGlobalCooldownMs() {
        return globalCooldownMs;
    }

    public long getPerObjectCooldownMs() {
        return perObjectCooldownMs;
    }

    public long getDirectionalCooldownMs() {
        return directionalCooldownMs;
    }

    public double getMinAnnounceWidth() {
        return minAnnounceWidth;
    }

    public double getEdgeThreshold() {
        return edgeThreshold;
    }

    public double getMediumPriorityThreshold() {
        return mediumPriorityThreshold;
    }
}
