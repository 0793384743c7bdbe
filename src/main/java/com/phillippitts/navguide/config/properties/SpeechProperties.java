package com.phillippitts.navguide.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Speech arbiter suppression window and closest-object narrator tuning.
 */
@Validated
@ConfigurationProperties(prefix = "nav.speech")
public class SpeechProperties {

    /** INFORMATION-tier speech is muted this long after a navigation or urgent announcement. */
    @Min(0)
    private final long suppressionMs;

    private final boolean narratorEnabled;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double narratorMinConfidence;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private final double narratorEmaAlpha;

    @PositiveOrZero
    private final double narratorDistanceChangeThreshold;

    @Min(0)
    private final long narratorCooldownMs;

    @ConstructorBinding
    public SpeechProperties(Long suppressionMs,
                            Boolean narratorEnabled,
                            Double narratorMinConfidence,
                            Double narratorEmaAlpha,
                            Double narratorDistanceChangeThreshold,
                            Long narratorCooldownMs) {
        this.suppressionMs = suppressionMs == null ? 1500L : suppressionMs;
        this.narratorEnabled = narratorEnabled == null || narratorEnabled;
        this.narratorMinConfidence = narratorMinConfidence == null ? 0.40 : narratorMinConfidence;
        this.narratorEmaAlpha = narratorEmaAlpha == null ? 0.35 : narratorEmaAlpha;
        this.narratorDistanceChangeThreshold = narratorDistanceChangeThreshold == null
                ? 0.3 : narratorDistanceChangeThreshold;
        this.narratorCooldownMs = narratorCooldownMs == null ? 1200L : narratorCooldownMs;
    }

    public static SpeechProperties defaults() {
        return new SpeechProperties(null, null, null, null, null, null);
    }

    public long getSuppressionMs() {
        return suppressionMs;
    }

    public boolean isNarratorEnabled() {
        return narratorEnabled;
    }

    public double getNarratorMinConfidence() {
        return narratorMinConfidence;
    }

    public double getNarratorEmaAlpha() {
        return narratorEmaAlpha;
    }

    public double getNarratorDistanceChangeThreshold() {
        return narratorDistanceChangeThreshold;
    }

    public long getNarratorCooldownMs() {
        return narratorCooldownMs;
    }
}
