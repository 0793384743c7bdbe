package com.phillippitts.navguide.domain;

/**
 * Detector output as delivered by the external inference collaborator, in pixel coordinates.
 *
 * <p>No validation is applied here; malformed values are clamped by the normalizer.
 *
 * @param label          class label, may be null or blank when the detector gave none
 * @param score          raw confidence score
 * @param left           bounding-box left edge in pixels
 * @param top            bounding-box top edge in pixels
 * @param right          bounding-box right edge in pixels
 * @param bottom         bounding-box bottom edge in pixels
 * @param relativeDepth  median relative depth over the box region, or {@code null}
 * @param distanceMeters already-calibrated metric distance, or {@code null}
 */
public record RawDetection(
        String label,
        double score,
        double left,
        double top,
        double right,
        double bottom,
        Double relativeDepth,
        Double distanceMeters
) {

    /**
     * Creates a raw detection without any depth information.
     */
    public static RawDetection withoutDepth(String label, double score,
                                            double left, double top, double right, double bottom) {
        return new RawDetection(label, score, left, top, right, bottom, null, null);
    }
}
