package com.phillippitts.navguide.service.session.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted after a navigation session reset cleared all gate and arbiter state.
 *
 * @param previousSessionId session that ended
 * @param sessionId         session that started
 * @param timestamp         when the reset completed
 */
public record SessionResetEvent(UUID previousSessionId, UUID sessionId, Instant timestamp) {}
