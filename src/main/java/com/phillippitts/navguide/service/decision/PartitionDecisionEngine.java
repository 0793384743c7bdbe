package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.config.properties.DecisionProperties;
import com.phillippitts.navguide.domain.DecisionResult;
import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.NavigationDecision;
import com.phillippitts.navguide.domain.PartitionAnalysis;
import com.phillippitts.navguide.domain.Zone;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateless decision function of the partition path.
 *
 * <p>The closest target (minimum distance, first wins ties) drives the decision, checked in order:
 * <ol>
 *   <li>STOP when occupancy &ge; full-block threshold and distance &le; stop distance</li>
 *   <li>Lateral avoidance when occupancy &ge; large-object threshold and distance &le; alert distance</li>
 *   <li>GO_STRAIGHT when the center zone is LEFT or RIGHT; lateral avoidance when CENTER</li>
 * </ol>
 */
public final class PartitionDecisionEngine {

    private static final Logger LOG = LogManager.getLogger(PartitionDecisionEngine.class);

    private final DecisionProperties properties;

    public PartitionDecisionEngine(DecisionProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Keeps detections with sufficient confidence and a known distance within the navigation horizon.
     */
    public List<Detection> selectTargets(List<Detection> detections) {
        return detections.stream()
                .filter(d -> d.confidence() >= properties.getMinConfidence())
                .filter(Detection::hasDistance)
                .filter(d -> d.distanceMeters() <= properties.getNavigationDistanceThreshold())
                .toList();
    }

    /**
     * Decides for one frame.
     *
     * @param analyses analyses of the selected targets; each must carry a distance
     * @return the decision, or empty when there is nothing to avoid (path clear)
     */
    public Optional<DecisionResult> decide(List<PartitionAnalysis> analyses) {
        PartitionAnalysis closest = null;
        for (PartitionAnalysis a : analyses) {
            if (!a.detection().hasDistance()) {
                continue;
            }
            if (closest == null || a.detection().distanceMeters() < closest.detection().distanceMeters()) {
                closest = a;
            }
        }
        if (closest == null) {
            return Optional.empty();
        }

        double distance = closest.detection().distanceMeters();
        double occupancy = closest.overallOccupancy();
        NavigationDecision decision;
        if (occupancy >= properties.getFullBlockThreshold() && distance <= properties.getStopDistance()) {
            decision = NavigationDecision.STOP;
        } else if (occupancy >= properties.getLargeObjectThreshold() && distance <= properties.getAlertDistance()) {
            decision = LateralChooser.choose(analyses);
        } else if (closest.centerZone() == Zone.CENTER) {
            decision = LateralChooser.choose(analyses);
        } else {
            decision = NavigationDecision.GO_STRAIGHT;
        }

        LOG.debug("Decision: {} for {} at {}m occ={} center={}", decision, closest.detection().label(),
                distance, occupancy, closest.centerZone());
        return Optional.of(new DecisionResult(decision, distance, occupancy,
                closest.detection().label(), closest.zoneCoverage()));
    }
}
