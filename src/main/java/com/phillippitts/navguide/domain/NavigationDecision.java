package com.phillippitts.navguide.domain;

/**
 * Instruction chosen by the partition decision engine.
 *
 * <p>Plain value type. Spoken text and urgency live in
 * {@link com.phillippitts.navguide.service.decision.NavigationPhrases}.
 */
public enum NavigationDecision {
    STOP,
    STEP_LEFT,
    STEP_RIGHT,
    GO_STRAIGHT
}
