package com.phillippitts.navguide.domain;

import java.util.Objects;

/**
 * Output of the legacy scoring path: the single most important object for this frame.
 *
 * @param label     object label
 * @param direction horizontal direction of the object
 * @param distance  distance bucket
 * @param priority  ranking score (higher is more important)
 */
public record Guidance(String label, Direction direction, DistanceCategory distance, double priority) {

    public Guidance {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(distance, "distance");
    }
}
