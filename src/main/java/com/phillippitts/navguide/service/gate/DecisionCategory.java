package com.phillippitts.navguide.service.gate;

import com.phillippitts.navguide.domain.NavigationDecision;

/**
 * Coarse decision category for change tracking. STEP_LEFT and STEP_RIGHT share
 * {@link #LATERAL} so a flipping lateral choice does not read as a new decision.
 */
public enum DecisionCategory {
    STOP,
    LATERAL,
    STRAIGHT;

    public static DecisionCategory of(NavigationDecision decision) {
        return switch (decision) {
            case STOP -> STOP;
            case STEP_LEFT, STEP_RIGHT -> LATERAL;
            case GO_STRAIGHT -> STRAIGHT;
        };
    }
}
