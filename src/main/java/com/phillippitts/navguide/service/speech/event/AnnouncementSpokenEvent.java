package com.phillippitts.navguide.service.speech.event;

import com.phillippitts.navguide.service.speech.SpeechTier;

import java.time.Instant;

/**
 * Published after the speech sink accepted an utterance.
 *
 * @param text      spoken text
 * @param tier      priority tier of the request
 * @param interrupt whether the request preempted earlier output
 * @param timestamp when the arbiter accepted the request
 */
public record AnnouncementSpokenEvent(String text, SpeechTier tier, boolean interrupt, Instant timestamp) {}
