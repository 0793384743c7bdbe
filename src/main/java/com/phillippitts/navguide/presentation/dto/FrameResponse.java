package com.phillippitts.navguide.presentation.dto;

import com.phillippitts.navguide.service.session.FrameOutcome;

/**
 * Result of posting a frame.
 *
 * @param sessionId      id of the session that processed the frame
 * @param strategy       active navigation strategy
 * @param detectionCount detections after normalization
 * @param navigation     navigation verdict
 * @param narration      narrator verdict, {@code null} when narration is off or guidance paused
 */
public record FrameResponse(String sessionId,
                            String strategy,
                            int detectionCount,
                            VerdictView navigation,
                            VerdictView narration) {

    public static FrameResponse of(FrameOutcome outcome) {
        return new FrameResponse(outcome.sessionId().toString(),
                outcome.strategy(),
                outcome.detectionCount(),
                VerdictView.of(outcome.navigation()),
                VerdictView.of(outcome.narration()));
    }
}
