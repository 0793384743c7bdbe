package com.phillippitts.navguide.domain;

import java.util.Objects;

/**
 * A navigation decision together with the metrics of the object that produced it.
 *
 * @param decision       chosen instruction
 * @param distanceMeters distance of the closest object
 * @param occupancy      overall occupancy of the closest object
 * @param objectLabel    label of the closest object
 * @param zoneCoverage   zone coverage of the closest object
 */
public record DecisionResult(
        NavigationDecision decision,
        double distanceMeters,
        double occupancy,
        String objectLabel,
        ZoneCoverage zoneCoverage
) {

    public DecisionResult {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(objectLabel, "objectLabel");
        Objects.requireNonNull(zoneCoverage, "zoneCoverage");
    }
}
