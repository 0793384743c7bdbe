package com.phillippitts.navguide.service.session;

import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.domain.Frame;
import com.phillippitts.navguide.service.decision.NavigationStrategy;
import com.phillippitts.navguide.service.detection.DetectionNormalizer;
import com.phillippitts.navguide.service.gate.GateVerdict;
import com.phillippitts.navguide.service.gate.SuppressionReason;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.service.session.event.SessionResetEvent;
import com.phillippitts.navguide.service.speech.ClosestObjectNarrator;
import com.phillippitts.navguide.service.speech.SceneDescriptionAnnouncer;
import com.phillippitts.navguide.service.speech.SpeechArbiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns one navigation session and runs the per-frame pipeline:
 * normalize, decide and gate through the active {@link NavigationStrategy}, then narrate.
 *
 * <p><b>Thread Safety:</b> frames run concurrently under the read lock; {@link #reset()} takes
 * the write lock, so no gate is evaluated while state is being cleared. Lock order is always
 * session, then gate, then arbiter.
 *
 * <p><b>Pause:</b> while paused frames are still accepted but nothing is announced. Pausing
 * stops current speech. A scene description pauses the session until its utterance was
 * handed to the sink.
 *
 * @since 1.0
 */
public final class NavigationSession {

    private static final Logger LOG = LogManager.getLogger(NavigationSession.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final ReadWriteLock sessionLock = new ReentrantReadWriteLock();
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private final DetectionNormalizer normalizer;
    private final NavigationStrategy strategy;
    private final ClosestObjectNarrator narrator;
    private final SpeechArbiter arbiter;
    private final SceneDescriptionAnnouncer sceneAnnouncer;
    private final Executor frameExecutor;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final NavigationMetricsPublisher metrics;

    private volatile UUID sessionId = UUID.randomUUID();

    /**
     * @param narrator closest-object narrator, or {@code null} to disable narration
     */
    public NavigationSession(DetectionNormalizer normalizer,
                             NavigationStrategy strategy,
                             ClosestObjectNarrator narrator,
                             SpeechArbiter arbiter,
                             SceneDescriptionAnnouncer sceneAnnouncer,
                             Executor frameExecutor,
                             Clock clock,
                             ApplicationEventPublisher publisher,
                             NavigationMetricsPublisher metrics) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.narrator = narrator;
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
        this.sceneAnnouncer = Objects.requireNonNull(sceneAnnouncer, "sceneAnnouncer");
        this.frameExecutor = Objects.requireNonNull(frameExecutor, "frameExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? NavigationMetricsPublisher.NOOP : metrics;
        LOG.info("Navigation session {} started with strategy={}, narrator={}",
                sessionId, strategy.name(), narrator != null ? "on" : "off");
    }

    /**
     * Runs one pipeline pass on the calling thread.
     *
     * @throws com.phillippitts.navguide.exception.InvalidFrameException if the frame is unusable
     */
    public FrameOutcome processFrame(Frame frame) {
        List<Detection> detections = normalizer.normalize(frame);
        long start = System.nanoTime();
        sessionLock.readLock().lock();
        String previousMdc = ThreadContext.get(MDC_SESSION_ID);
        try {
            UUID current = sessionId;
            ThreadContext.put(MDC_SESSION_ID, current.toString());
            if (paused.get()) {
                LOG.debug("Frame ignored, guidance paused ({} detections)", detections.size());
                metrics.recordSuppressed("session", SuppressionReason.PAUSED);
                return new FrameOutcome(current, strategy.name(), detections.size(),
                        GateVerdict.suppress(SuppressionReason.PAUSED), null);
            }
            GateVerdict navigation = strategy.process(detections, frame.imageWidth());
            GateVerdict narration = narrator == null ? null : narrator.process(detections);
            return new FrameOutcome(current, strategy.name(), detections.size(), navigation, narration);
        } finally {
            if (previousMdc == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previousMdc);
            }
            sessionLock.readLock().unlock();
            metrics.recordFrame(strategy.name(), System.nanoTime() - start);
        }
    }

    /**
     * Runs one pipeline pass on the frame executor.
     */
    public CompletableFuture<FrameOutcome> submitFrame(Frame frame) {
        return CompletableFuture.supplyAsync(() -> processFrame(frame), frameExecutor);
    }

    /**
     * Starts a new session: clears every gate, the narrator and the arbiter, atomically with
     * respect to frames in progress.
     *
     * @return the new session id
     */
    public UUID reset() {
        sessionLock.writeLock().lock();
        try {
            UUID previous = sessionId;
            strategy.reset();
            if (narrator != null) {
                narrator.reset();
            }
            arbiter.reset();
            sessionId = UUID.randomUUID();
            LOG.info("Navigation session reset: {} -> {}", previous, sessionId);
            publisher.publishEvent(new SessionResetEvent(previous, sessionId, clock.instant()));
            return sessionId;
        } finally {
            sessionLock.writeLock().unlock();
        }
    }

    /**
     * Pauses guidance and stops current speech.
     *
     * @return {@code true} if the session was running before
     */
    public boolean pause() {
        boolean wasRunning = paused.compareAndSet(false, true);
        arbiter.stop();
        if (wasRunning) {
            LOG.info("Navigation guidance paused");
        }
        return wasRunning;
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            LOG.info("Navigation guidance resumed");
        }
    }

    /**
     * Speaks a scene description with navigation output paused until the sink took it.
     * A session that was already paused stays paused.
     */
    public CompletableFuture<Void> describeScene(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Scene description must not be blank");
        }
        boolean pausedHere = pause();
        return sceneAnnouncer.announce(description)
                .whenComplete((ignored, error) -> {
                    if (pausedHere) {
                        resume();
                    }
                });
    }

    public boolean isPaused() {
        return paused.get();
    }

    public UUID sessionId() {
        return sessionId;
    }

    public String strategyName() {
        return strategy.name();
    }
}
