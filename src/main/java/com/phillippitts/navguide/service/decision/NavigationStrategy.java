package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.service.gate.GateVerdict;

import java.util.List;

/**
 * One complete decision path: decide on a frame's detections, gate the result and hand
 * any announcement to the speech arbiter.
 *
 * <p>Implementations: {@link PartitionNavigationStrategy} (default) and
 * {@link LegacyNavigationStrategy}, selected by {@code nav.decision.strategy}.
 */
public interface NavigationStrategy {

    /**
     * Runs decision and gate for one frame.
     *
     * @param detections normalized detections of the frame
     * @param frameWidth frame width in pixels
     * @return whether an announcement was spoken, or which rule suppressed it
     */
    GateVerdict process(List<Detection> detections, double frameWidth);

    /**
     * Clears all gate state owned by this strategy.
     */
    void reset();

    /**
     * Short name used in logs and metrics tags.
     */
    String name();
}
