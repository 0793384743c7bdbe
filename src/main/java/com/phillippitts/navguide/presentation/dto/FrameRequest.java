package com.phillippitts.navguide.presentation.dto;

import com.phillippitts.navguide.domain.Frame;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Detector output for one camera frame.
 *
 * @param imageWidth  frame width in pixels
 * @param imageHeight frame height in pixels
 * @param detections  detected boxes, empty when the path is clear
 */
public record FrameRequest(
        @Positive int imageWidth,
        @Positive int imageHeight,
        @NotNull List<@NotNull @Valid DetectionPayload> detections
) {

    public Frame toFrame() {
        return new Frame(imageWidth, imageHeight,
                detections == null ? null : detections.stream().map(p -> p == null ? null : p.toRawDetection()).toList());
    }
}
