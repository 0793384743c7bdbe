package com.phillippitts.navguide.service.gate;

/**
 * Why a candidate announcement was not spoken.
 *
 * <p>Suppression is the intended outcome of every rule below, not an error.
 */
public enum SuppressionReason {
    // legacy rate limiter, in evaluation order
    GLOBAL_COOLDOWN,
    FAR_DISTANCE,
    MEDIUM_NOT_CRITICAL,
    TOO_SMALL,
    FRAME_EDGE,
    OBJECT_COOLDOWN,
    DIRECTIONAL_COOLDOWN,
    NOT_MORE_DANGEROUS,

    // partition gate
    ANTI_SPAM_FLOOR,
    NO_MEANINGFUL_CHANGE,
    PATH_CLEAR_INTERVAL,

    // arbiter and pipeline
    ARBITER_REJECTED,
    INFORMATION_SUPPRESSED,
    NARRATOR_COOLDOWN,
    NARRATOR_HYSTERESIS,
    NO_CANDIDATE,
    PAUSED
}
