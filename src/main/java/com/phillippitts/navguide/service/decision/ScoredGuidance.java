package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.Guidance;

/**
 * Top-ranked guidance together with the detection it was derived from; the rate limiter
 * needs the detection's width and horizontal center.
 */
public record ScoredGuidance(Guidance guidance, Detection detection) {}
