package com.phillippitts.navguide.presentation.dto;

import com.phillippitts.navguide.service.session.NavigationSession;

/**
 * Current session state.
 */
public record SessionResponse(String sessionId, String strategy, boolean paused) {

    public static SessionResponse of(NavigationSession session) {
        return new SessionResponse(session.sessionId().toString(), session.strategyName(), session.isPaused());
    }
}
