package com.phillippitts.navguide.presentation.controller;

import com.phillippitts.navguide.presentation.dto.FrameRequest;
import com.phillippitts.navguide.presentation.dto.FrameResponse;
import com.phillippitts.navguide.presentation.dto.SceneRequest;
import com.phillippitts.navguide.presentation.dto.SessionResponse;
import com.phillippitts.navguide.service.session.NavigationSession;
import com.phillippitts.navguide.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * REST entry point for the detector client.
 *
 * <p>Frames are processed on the frame executor; the request completes when the pipeline pass
 * (decision, gate and arbiter acceptance) is done, not when speech finished playing.
 */
@RestController
@RequestMapping("/api/navigation")
class NavigationController {

    private static final Logger LOG = LogManager.getLogger(NavigationController.class);

    private static final int MAX_LOGGED_CHARS = 60;

    private final NavigationSession session;

    NavigationController(NavigationSession session) {
        this.session = session;
    }

    @PostMapping("/frames")
    CompletableFuture<FrameResponse> submitFrame(@Valid @RequestBody FrameRequest request) {
        LOG.debug("Frame received: {}x{} with {} detections",
                request.imageWidth(), request.imageHeight(), request.detections().size());
        return session.submitFrame(request.toFrame()).thenApply(FrameResponse::of);
    }

    @GetMapping("/session")
    SessionResponse session() {
        return SessionResponse.of(session);
    }

    /**
     * Starts a fresh session. Pause state is kept.
     */
    @PostMapping("/session/reset")
    SessionResponse reset() {
        session.reset();
        return SessionResponse.of(session);
    }

    @PostMapping("/session/pause")
    SessionResponse pause() {
        session.pause();
        return SessionResponse.of(session);
    }

    /**
     * Resumes guidance in a fresh session, so nothing said before the pause suppresses
     * the first announcements after it.
     */
    @PostMapping("/session/resume")
    SessionResponse resume() {
        session.reset();
        session.resume();
        return SessionResponse.of(session);
    }

    /**
     * Reads out a scene description. Completes with 202 once the sink accepted the text.
     */
    @PostMapping("/scene")
    CompletableFuture<ResponseEntity<Void>> describeScene(@Valid @RequestBody SceneRequest request) {
        LOG.info("Scene description requested: \"{}\"", LogSanitizer.preview(request.description(), MAX_LOGGED_CHARS));
        return session.describeScene(request.description())
                .thenApply(ignored -> ResponseEntity.accepted().<Void>build());
    }
}
