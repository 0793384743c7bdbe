package com.phillippitts.navguide.service.session;

import com.phillippitts.navguide.service.gate.GateVerdict;

import java.util.UUID;

/**
 * Result of one pipeline pass.
 *
 * @param sessionId      session the frame was processed in
 * @param strategy       name of the active navigation strategy
 * @param detectionCount number of normalized detections in the frame
 * @param navigation     verdict of the navigation strategy
 * @param narration      verdict of the closest-object narrator, or {@code null} when it is disabled
 *                       or the session is paused
 */
public record FrameOutcome(UUID sessionId,
                           String strategy,
                           int detectionCount,
                           GateVerdict navigation,
                           GateVerdict narration) {}
