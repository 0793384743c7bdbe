package com.phillippitts.navguide.presentation.dto;

import com.phillippitts.navguide.domain.RawDetection;

/**
 * One detector box as posted by the camera client, in pixel coordinates.
 * Out-of-range values are accepted and clamped downstream.
 */
public record DetectionPayload(
        String label,
        double score,
        double left,
        double top,
        double right,
        double bottom,
        Double relativeDepth,
        Double distanceMeters
) {

    public RawDetection toRawDetection() {
        return new RawDetection(label, score, left, top, right, bottom, relativeDepth, distanceMeters);
    }
}
