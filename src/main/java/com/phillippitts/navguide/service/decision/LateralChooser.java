package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.NavigationDecision;
import com.phillippitts.navguide.domain.PartitionAnalysis;
import com.phillippitts.navguide.domain.Zone;

import java.util.List;

/**
 * Picks the side with less aggregate obstruction.
 *
 * <p>Sums left coverage over every analysis overlapping LEFT and right coverage over every
 * analysis overlapping RIGHT, then steps toward the smaller sum. Equal sums step right.
 */
public final class LateralChooser {

    private LateralChooser() {}

    public static NavigationDecision choose(List<PartitionAnalysis> analyses) {
        double left = 0.0;
        double right = 0.0;
        for (PartitionAnalysis a : analyses) {
            if (a.overlaps(Zone.LEFT)) {
                left += a.zoneCoverage().leftPct();
            }
            if (a.overlaps(Zone.RIGHT)) {
                right += a.zoneCoverage().rightPct();
            }
        }
        if (left < right) {
            return NavigationDecision.STEP_LEFT;
        }
        return NavigationDecision.STEP_RIGHT;
    }
}
