package com.phillippitts.navguide.service.detection;

import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.Frame;
import com.phillippitts.navguide.domain.RawDetection;
import com.phillippitts.navguide.exception.InvalidFrameException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps raw detector output in pixels to canonical {@link Detection} records.
 *
 * <p>This is the only validation boundary of the pipeline. Values outside their documented
 * range are clamped, never propagated:
 * <ul>
 *   <li>Pixel coordinates are clamped to the frame; reversed edges are swapped</li>
 *   <li>Confidence is clamped to [0, 1]; NaN becomes 0</li>
 *   <li>A null or blank label becomes {@value #UNKNOWN_LABEL}</li>
 *   <li>A given metric distance wins over relative depth; both absent means unknown</li>
 * </ul>
 *
 * <p>Only structurally unusable frames raise {@link InvalidFrameException}.
 */
public final class DetectionNormalizer {

    private static final Logger LOG = LogManager.getLogger(DetectionNormalizer.class);

    static final String UNKNOWN_LABEL = "unknown";

    private final DepthCalibration calibration;

    public DetectionNormalizer(DepthCalibration calibration) {
        this.calibration = Objects.requireNonNull(calibration, "calibration");
    }

    /**
     * Normalizes every detection in the frame, preserving detector order.
     *
     * @param frame raw frame from the detector collaborator
     * @return normalized detections (possibly empty, never null)
     * @throws InvalidFrameException if the frame has non-positive size, no detection list or a null detection
     */
    public List<Detection> normalize(Frame frame) {
        if (frame == null) {
            throw new InvalidFrameException("frame is null");
        }
        int w = frame.imageWidth();
        int h = frame.imageHeight();
        if (w <= 0 || h <= 0) {
            throw new InvalidFrameException(w, h, "image dimensions must be positive");
        }
        if (frame.detections() == null) {
            throw new InvalidFrameException(w, h, "detection list is missing");
        }

        List<Detection> out = new ArrayList<>(frame.detections().size());
        for (int i = 0; i < frame.detections().size(); i++) {
            RawDetection raw = frame.detections().get(i);
            if (raw == null) {
                throw new InvalidFrameException(w, h, "detection " + i + " is null");
            }
            out.add(normalize(raw, w, h));
        }
        return out;
    }

    Detection normalize(RawDetection raw, int imageWidth, int imageHeight) {
        double left = clamp(raw.left(), imageWidth);
        double right = clamp(raw.right(), imageWidth);
        double top = clamp(raw.top(), imageHeight);
        double bottom = clamp(raw.bottom(), imageHeight);
        if (left > right) {
            double t = left;
            left = right;
            right = t;
        }
        if (top > bottom) {
            double t = top;
            top = bottom;
            bottom = t;
        }

        double xCenter = unit((left + right) / 2.0 / imageWidth);
        double yCenter = unit((top + bottom) / 2.0 / imageHeight);
        double width = unit((right - left) / imageWidth);
        double height = unit((bottom - top) / imageHeight);

        double confidence = unit(raw.score());
        if (confidence != raw.score()) {
            LOG.debug("Clamped confidence {} -> {} for label={}", raw.score(), confidence, raw.label());
        }

        return new Detection(label(raw.label()), confidence, xCenter, yCenter, width, height, distance(raw));
    }

    private Double distance(RawDetection raw) {
        if (raw.distanceMeters() != null) {
            Double meters = calibration.clampMeters(raw.distanceMeters());
            if (meters != null) {
                return meters;
            }
        }
        if (raw.relativeDepth() != null) {
            return calibration.toMeters(raw.relativeDepth());
        }
        return null;
    }

    private static String label(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN_LABEL;
        }
        return raw.trim();
    }

    private static double clamp(double value, int max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(max, value));
    }

    private static double unit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
