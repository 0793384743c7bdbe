package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.Guidance;
import com.phillippitts.navguide.service.gate.GateVerdict;
import com.phillippitts.navguide.service.gate.SuppressionReason;
import com.phillippitts.navguide.service.gate.WarningRateLimiter;
import com.phillippitts.navguide.service.speech.SpeechArbiter;
import com.phillippitts.navguide.service.speech.SpeechTier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Legacy path: rank by score, pass the top guidance through the rate limiter, speak it.
 *
 * <p>The limiter records as part of its check, before the arbiter is asked. An arbiter
 * rejection therefore still consumes the cooldowns.
 */
public final class LegacyNavigationStrategy implements NavigationStrategy {

    private static final Logger LOG = LogManager.getLogger(LegacyNavigationStrategy.class);

    public static final String NAME = "legacy";

    private final ScoringDecisionEngine engine;
    private final WarningRateLimiter limiter;
    private final SpeechArbiter arbiter;

    public LegacyNavigationStrategy(ScoringDecisionEngine engine, WarningRateLimiter limiter, SpeechArbiter arbiter) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
    }

    @Override
    public GateVerdict process(List<Detection> detections, double frameWidth) {
        Optional<ScoredGuidance> top = engine.analyze(detections);
        if (top.isEmpty()) {
            return GateVerdict.suppress(SuppressionReason.NO_CANDIDATE);
        }
        Guidance guidance = top.get().guidance();
        Detection detection = top.get().detection();

        GateVerdict verdict = limiter.tryAcquire(guidance, detection.width(), detection.xCenter());
        if (verdict.suppressed()) {
            return verdict;
        }

        String text = NavigationPhrases.text(guidance);
        SpeechTier tier = NavigationPhrases.tierFor(guidance);
        if (!arbiter.request(text, tier, tier == SpeechTier.URGENT)) {
            LOG.debug("Legacy guidance blocked by arbiter: \"{}\"", text);
            return GateVerdict.suppress(SuppressionReason.ARBITER_REJECTED);
        }
        LOG.info("Guidance: \"{}\" [{}] priority={}", text, tier, guidance.priority());
        return GateVerdict.spoken(text);
    }

    @Override
    public void reset() {
        limiter.reset();
    }

    @Override
    public String name() {
        return NAME;
    }
}
