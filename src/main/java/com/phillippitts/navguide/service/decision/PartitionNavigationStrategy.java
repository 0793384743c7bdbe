package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.DecisionResult;
import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.PartitionAnalysis;
import com.phillippitts.navguide.service.gate.GateVerdict;
import com.phillippitts.navguide.service.gate.PartitionAnnouncementGate;
import com.phillippitts.navguide.service.partition.PartitionAnalyzer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Partition path: select targets, analyze zones, decide, then gate.
 * No qualifying target is the path-clear state.
 */
public final class PartitionNavigationStrategy implements NavigationStrategy {

    public static final String NAME = "partition";

    private final PartitionAnalyzer analyzer;
    private final PartitionDecisionEngine engine;
    private final PartitionAnnouncementGate gate;

    public PartitionNavigationStrategy(PartitionAnalyzer analyzer,
                                       PartitionDecisionEngine engine,
                                       PartitionAnnouncementGate gate) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.gate = Objects.requireNonNull(gate, "gate");
    }

    @Override
    public GateVerdict process(List<Detection> detections, double frameWidth) {
        List<Detection> targets = engine.selectTargets(detections);
        if (targets.isEmpty()) {
            return gate.onPathClear();
        }
        List<PartitionAnalysis> analyses = analyzer.analyzeAll(targets, frameWidth);
        Optional<DecisionResult> decision = engine.decide(analyses);
        return decision.map(gate::onDecision).orElseGet(gate::onPathClear);
    }

    @Override
    public void reset() {
        gate.reset();
    }

    @Override
    public String name() {
        return NAME;
    }
}
