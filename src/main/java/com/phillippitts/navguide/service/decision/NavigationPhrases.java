package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.Direction;
import com.phillippitts.navguide.domain.DistanceCategory;
import com.phillippitts.navguide.domain.Guidance;
import com.phillippitts.navguide.domain.NavigationDecision;
import com.phillippitts.navguide.service.speech.SpeechTier;

/**
 * Maps decisions and guidance to spoken text, urgency and speech tier.
 */
public final class NavigationPhrases {

    public static final String PATH_CLEAR = "path clear, move straight";

    private NavigationPhrases() {}

    /**
     * Partition-path announcement, e.g. {@code "chair ahead of you, move left"}.
     */
    public static String text(NavigationDecision decision, String label) {
        return label + " ahead of you, " + instruction(decision);
    }

    public static String instruction(NavigationDecision decision) {
        return switch (decision) {
            case STOP -> "stop";
            case STEP_LEFT -> "move left";
            case STEP_RIGHT -> "move right";
            case GO_STRAIGHT -> "move straight";
        };
    }

    public static boolean isUrgent(NavigationDecision decision) {
        return decision == NavigationDecision.STOP;
    }

    public static SpeechTier tierFor(NavigationDecision decision) {
        return isUrgent(decision) ? SpeechTier.URGENT : SpeechTier.NAVIGATION;
    }

    /**
     * Legacy-path announcement, e.g. {@code "person to your left, close, slow down"}.
     */
    public static String text(Guidance guidance) {
        return guidance.label() + " " + where(guidance.direction()) + ", " + howClose(guidance.distance());
    }

    /** VERY_CLOSE legacy guidance is spoken as URGENT; everything else as NAVIGATION. */
    public static SpeechTier tierFor(Guidance guidance) {
        return guidance.distance() == DistanceCategory.VERY_CLOSE ? SpeechTier.URGENT : SpeechTier.NAVIGATION;
    }

    private static String where(Direction direction) {
        return switch (direction) {
            case LEFT -> "to your left";
            case CENTER -> "ahead";
            case RIGHT -> "to your right";
        };
    }

    private static String howClose(DistanceCategory category) {
        return switch (category) {
            case VERY_CLOSE -> "very close, stop";
            case CLOSE -> "close, slow down";
            case MEDIUM -> "approaching";
            case FAR -> "in the distance";
        };
    }
}
