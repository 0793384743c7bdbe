package com.phillippitts.navguide.service.speech.event;

import com.phillippitts.navguide.service.speech.SpeechTier;

import java.time.Instant;

/**
 * Published when the speech sink rejected or failed an utterance.
 *
 * @param tier      priority tier of the failed request
 * @param reason    short failure category ("rejected", "error", "executor_rejected")
 * @param timestamp when the failure was observed
 */
public record SpeechFailedEvent(SpeechTier tier, String reason, Instant timestamp) {}
