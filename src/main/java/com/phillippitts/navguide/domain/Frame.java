package com.phillippitts.navguide.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One camera frame's worth of detector output.
 *
 * @param imageWidth  source image width in pixels
 * @param imageHeight source image height in pixels
 * @param detections  raw detections for the frame (copied; null elements are kept and rejected by the normalizer)
 */
public record Frame(int imageWidth, int imageHeight, List<RawDetection> detections) {

    public Frame {
        detections = detections == null ? null : Collections.unmodifiableList(new ArrayList<>(detections));
    }
}
