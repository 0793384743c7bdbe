package com.phillippitts.navguide.config;

import com.phillippitts.navguide.config.properties.DecisionProperties;
import com.phillippitts.navguide.config.properties.DepthProperties;
import com.phillippitts.navguide.config.properties.GateProperties;
import com.phillippitts.navguide.config.properties.LegacyProperties;
import com.phillippitts.navguide.config.properties.SpeechProperties;
import com.phillippitts.navguide.service.decision.LegacyNavigationStrategy;
import com.phillippitts.navguide.service.decision.NavigationStrategy;
import com.phillippitts.navguide.service.decision.PartitionDecisionEngine;
import com.phillippitts.navguide.service.decision.PartitionNavigationStrategy;
import com.phillippitts.navguide.service.decision.ScoringDecisionEngine;
import com.phillippitts.navguide.service.detection.DepthCalibration;
import com.phillippitts.navguide.service.detection.DetectionNormalizer;
import com.phillippitts.navguide.service.gate.PartitionAnnouncementGate;
import com.phillippitts.navguide.service.gate.WarningRateLimiter;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.service.partition.PartitionAnalyzer;
import com.phillippitts.navguide.service.session.NavigationSession;
import com.phillippitts.navguide.service.speech.ClosestObjectNarrator;
import com.phillippitts.navguide.service.speech.LoggingSpeechSink;
import com.phillippitts.navguide.service.speech.SceneDescriptionAnnouncer;
import com.phillippitts.navguide.service.speech.SpeechArbiter;
import com.phillippitts.navguide.service.speech.SpeechSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the frame pipeline explicitly: normalizer, the configured decision strategy with its
 * gate, the speech arbiter and its producers, and the session that owns them.
 *
 * <p>Exactly one {@link NavigationStrategy} is active, chosen by {@code nav.decision.strategy}.
 * Both strategies share the single {@link SpeechArbiter}.
 */
@Configuration
public class NavigationConfig {

    private static final Logger LOG = LogManager.getLogger(NavigationConfig.class);

    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final NavigationMetricsPublisher metricsPublisher;

    public NavigationConfig(Clock clock,
                            ApplicationEventPublisher publisher,
                            NavigationMetricsPublisher metricsPublisher) {
        this.clock = clock;
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public DepthCalibration depthCalibration(DepthProperties depthProperties) {
        return new DepthCalibration(depthProperties);
    }

    @Bean
    public DetectionNormalizer detectionNormalizer(DepthCalibration depthCalibration) {
        return new DetectionNormalizer(depthCalibration);
    }

    @Bean
    public PartitionAnalyzer partitionAnalyzer() {
        return new PartitionAnalyzer();
    }

    @Bean
    public PartitionDecisionEngine partitionDecisionEngine(DecisionProperties decisionProperties) {
        return new PartitionDecisionEngine(decisionProperties);
    }

    @Bean
    public ScoringDecisionEngine scoringDecisionEngine(LegacyProperties legacyProperties,
                                                       DepthCalibration depthCalibration) {
        return new ScoringDecisionEngine(legacyProperties, depthCalibration);
    }

    /**
     * Default sink. A deployment with a real audio path registers its own {@link SpeechSink}.
     */
    @Bean
    @ConditionalOnMissingBean(SpeechSink.class)
    public SpeechSink speechSink() {
        return new LoggingSpeechSink();
    }

    @Bean
    public SpeechArbiter speechArbiter(SpeechProperties speechProperties,
                                       SpeechSink speechSink,
                                       @Qualifier("speechExecutor") Executor speechExecutor) {
        return new SpeechArbiter(speechProperties, speechSink, speechExecutor, clock, publisher, metricsPublisher);
    }

    @Bean
    public PartitionAnnouncementGate partitionAnnouncementGate(GateProperties gateProperties,
                                                               SpeechArbiter speechArbiter) {
        return new PartitionAnnouncementGate(gateProperties, speechArbiter, clock, metricsPublisher);
    }

    @Bean
    public WarningRateLimiter warningRateLimiter(LegacyProperties legacyProperties) {
        return new WarningRateLimiter(legacyProperties, clock, metricsPublisher);
    }

    @Bean
    public NavigationStrategy navigationStrategy(DecisionProperties decisionProperties,
                                                 PartitionAnalyzer partitionAnalyzer,
                                                 PartitionDecisionEngine partitionDecisionEngine,
                                                 PartitionAnnouncementGate partitionAnnouncementGate,
                                                 ScoringDecisionEngine scoringDecisionEngine,
                                                 WarningRateLimiter warningRateLimiter,
                                                 SpeechArbiter speechArbiter) {
        NavigationStrategy strategy = switch (decisionProperties.getStrategy()) {
            case PARTITION -> new PartitionNavigationStrategy(
                    partitionAnalyzer, partitionDecisionEngine, partitionAnnouncementGate);
            case LEGACY -> new LegacyNavigationStrategy(
                    scoringDecisionEngine, warningRateLimiter, speechArbiter);
        };
        LOG.info("Navigation strategy: {}", strategy.name());
        return strategy;
    }

    @Bean
    public ClosestObjectNarrator closestObjectNarrator(SpeechProperties speechProperties,
                                                       SpeechArbiter speechArbiter) {
        return new ClosestObjectNarrator(speechProperties, speechArbiter, clock, metricsPublisher);
    }

    @Bean
    public SceneDescriptionAnnouncer sceneDescriptionAnnouncer(SpeechArbiter speechArbiter) {
        return new SceneDescriptionAnnouncer(speechArbiter);
    }

    /**
     * The session. Narration is left out when {@code nav.speech.narrator-enabled=false}.
     */
    @Bean
    public NavigationSession navigationSession(DetectionNormalizer detectionNormalizer,
                                               NavigationStrategy navigationStrategy,
                                               ClosestObjectNarrator closestObjectNarrator,
                                               SpeechArbiter speechArbiter,
                                               SceneDescriptionAnnouncer sceneDescriptionAnnouncer,
                                               SpeechProperties speechProperties,
                                               @Qualifier("frameExecutor") Executor frameExecutor) {
        ClosestObjectNarrator narrator = speechProperties.isNarratorEnabled() ? closestObjectNarrator : null;
        return new NavigationSession(detectionNormalizer, navigationStrategy, narrator, speechArbiter,
                sceneDescriptionAnnouncer, frameExecutor, clock, publisher, metricsPublisher);
    }
}
