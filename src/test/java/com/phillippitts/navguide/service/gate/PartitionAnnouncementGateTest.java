package com.phillippitts.navguide.service.gate;

import com.phillippitts.navguide.config.properties.GateProperties;
import com.phillippitts.navguide.config.properties.SpeechProperties;
import com.phillippitts.navguide.domain.DecisionResult;
import com.phillippitts.navguide.domain.NavigationDecision;
import com.phillippitts.navguide.domain.ZoneCoverage;
import com.phillippitts.navguide.service.decision.NavigationPhrases;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.service.speech.SpeechArbiter;
import com.phillippitts.navguide.service.speech.SpeechTier;
import com.phillippitts.navguide.testutil.EventCapturingPublisher;
import com.phillippitts.navguide.testutil.MutableClock;
import com.phillippitts.navguide.testutil.RecordingSpeechSink;
import com.phillippitts.navguide.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;

class PartitionAnnouncementGateTest {

    private MutableClock clock;
    private RecordingSpeechSink sink;
    private PartitionAnnouncementGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sink = new RecordingSpeechSink();
        SpeechArbiter arbiter = new SpeechArbiter(SpeechProperties.defaults(), sink, new SyncExecutor(), clock,
                new EventCapturingPublisher(), NavigationMetricsPublisher.NOOP);
        gate = new PartitionAnnouncementGate(GateProperties.defaults(), arbiter, clock, NavigationMetricsPublisher.NOOP);
    }

    private static DecisionResult result(NavigationDecision decision, String label, double meters, double occupancy) {
        return new DecisionResult(decision, meters, occupancy, label, new ZoneCoverage(0.5, 0.5, 0.0));
    }

    @Test
    void firstDecisionIsSpoken() {
        GateVerdict v = gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3));

        assertThat(v.allowed()).isTrue();
        assertThat(v.announcement()).isEqualTo("chair ahead of you, move left");
        assertThat(sink.utterances()).singleElement().satisfies(u -> {
            assertThat(u.tier()).isEqualTo(SpeechTier.NAVIGATION);
            assertThat(u.interrupt()).isFalse();
        });
        assertThat(gate.lastDecisionCategory()).isEqualTo(DecisionCategory.LATERAL);
    }

    @Test
    void floorBlocksEvenNewObjects() {
        gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3));
        clock.advanceMillis(1999);

        GateVerdict v = gate.onDecision(result(NavigationDecision.STOP, "wall", 0.5, 0.9));

        assertThat(v.reason()).isEqualTo(SuppressionReason.ANTI_SPAM_FLOOR);
        assertThat(sink.utterances()).hasSize(1);
    }

    @Test
    void changedObjectIsSpokenAfterFloor() {
        gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3));
        clock.advanceMillis(2000);

        GateVerdict v = gate.onDecision(result(NavigationDecision.STEP_LEFT, "table", 2.0, 0.3));

        assertThat(v.announcement()).isEqualTo("table ahead of you, move left");
    }

    @Test
    void sameObjectNeedsIntervalAndMeaningfulChange() {
        gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3));

        clock.advanceMillis(3000);
        assertThat(gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 1.0, 0.3)).reason())
                .isEqualTo(SuppressionReason.NO_MEANINGFUL_CHANGE);

        clock.advanceMillis(2000);
        assertThat(gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 1.8, 0.35)).reason())
                .isEqualTo(SuppressionReason.NO_MEANINGFUL_CHANGE);

        assertThat(gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 1.4, 0.3)).allowed()).isTrue();
        assertThat(sink.utterances()).hasSize(2);
    }

    @Test
    void occupancyChangeAloneIsEnough() {
        gate.onDecision(result(NavigationDecision.GO_STRAIGHT, "bin", 2.0, 0.2));
        clock.advanceMillis(5000);

        assertThat(gate.onDecision(result(NavigationDecision.GO_STRAIGHT, "bin", 2.0, 0.35)).allowed()).isTrue();
    }

    @Test
    void stopRepeatsOnUrgentIntervalAndInterrupts() {
        gate.onDecision(result(NavigationDecision.STOP, "wall", 0.9, 0.8));
        clock.advanceMillis(2000);

        GateVerdict v = gate.onDecision(result(NavigationDecision.STOP, "wall", 0.3, 0.8));

        assertThat(v.announcement()).isEqualTo("wall ahead of you, stop");
        assertThat(sink.utterances()).hasSize(2)
                .allSatisfy(u -> {
                    assertThat(u.tier()).isEqualTo(SpeechTier.URGENT);
                    assertThat(u.interrupt()).isTrue();
                });
        assertThat(gate.lastDecisionCategory()).isEqualTo(DecisionCategory.STOP);
    }

    @Test
    void tenClearFramesOverNineSecondsSpeakTwice() {
        List<SuppressionReason> reasons = new ArrayList<>();
        for (int second = 0; second < 10; second++) {
            GateVerdict v = gate.onPathClear();
            reasons.add(v.reason());
            clock.advanceMillis(1000);
        }

        assertThat(sink.texts()).containsExactly(NavigationPhrases.PATH_CLEAR, NavigationPhrases.PATH_CLEAR);
        assertThat(reasons).containsExactly(
                null,
                SuppressionReason.ANTI_SPAM_FLOOR,
                SuppressionReason.PATH_CLEAR_INTERVAL,
                SuppressionReason.PATH_CLEAR_INTERVAL,
                SuppressionReason.PATH_CLEAR_INTERVAL,
                SuppressionReason.PATH_CLEAR_INTERVAL,
                SuppressionReason.PATH_CLEAR_INTERVAL,
                SuppressionReason.PATH_CLEAR_INTERVAL,
                null,
                SuppressionReason.ANTI_SPAM_FLOOR);
    }

    @Test
    void obstacleRestartsPathClearCycle() {
        gate.onPathClear();
        clock.advanceMillis(2500);
        gate.onDecision(result(NavigationDecision.STEP_RIGHT, "table", 1.5, 0.5));
        clock.advanceMillis(2500);

        assertThat(gate.onPathClear().allowed()).isTrue();
        assertThat(sink.texts()).containsExactly(
                NavigationPhrases.PATH_CLEAR, "table ahead of you, move right", NavigationPhrases.PATH_CLEAR);
    }

    @Test
    void pathClearForgetsLastObject() {
        gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3));
        clock.advanceMillis(2000);
        gate.onPathClear();
        clock.advanceMillis(2000);

        assertThat(gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3)).allowed()).isTrue();
    }

    @Test
    void arbiterRejectionRecordsNothing() {
        SpeechArbiter rejecting = new SpeechArbiter(SpeechProperties.defaults(), sink,
                command -> {
                    throw new RejectedExecutionException("full");
                },
                clock, new EventCapturingPublisher(), NavigationMetricsPublisher.NOOP);
        PartitionAnnouncementGate g = new PartitionAnnouncementGate(GateProperties.defaults(), rejecting, clock,
                NavigationMetricsPublisher.NOOP);

        assertThat(g.onDecision(result(NavigationDecision.STOP, "wall", 0.5, 0.9)).reason())
                .isEqualTo(SuppressionReason.ARBITER_REJECTED);
        assertThat(g.lastDecisionCategory()).isNull();
    }

    @Test
    void resetClearsFloorAndHistory() {
        gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3));
        gate.reset();

        assertThat(gate.lastDecisionCategory()).isNull();
        assertThat(gate.onDecision(result(NavigationDecision.STEP_LEFT, "chair", 2.0, 0.3)).allowed()).isTrue();
    }

    @Test
    void concurrentDecisionsSpeakOnceWithinFloor() throws Exception {
        List<GateVerdict> verdicts = runConcurrently(8,
                i -> () -> gate.onDecision(result(NavigationDecision.STEP_LEFT, "object-" + i, 2.0, 0.3)));

        assertThat(verdicts).filteredOn(GateVerdict::allowed).hasSize(1);
        assertThat(verdicts).filteredOn(v -> !v.allowed())
                .extracting(GateVerdict::reason)
                .containsOnly(SuppressionReason.ANTI_SPAM_FLOOR);
        assertThat(sink.utterances()).hasSize(1);
    }

    @Test
    void concurrentPathClearSpeaksOnce() throws Exception {
        List<GateVerdict> verdicts = runConcurrently(8, i -> gate::onPathClear);

        assertThat(verdicts).filteredOn(GateVerdict::allowed).hasSize(1);
        assertThat(sink.texts()).containsExactly(NavigationPhrases.PATH_CLEAR);
    }

    private static List<GateVerdict> runConcurrently(int threads, IntFunction<Callable<GateVerdict>> task)
            throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<GateVerdict>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<GateVerdict> call = task.apply(i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();

            List<GateVerdict> verdicts = new ArrayList<>();
            for (Future<GateVerdict> f : futures) {
                verdicts.add(f.get(5, TimeUnit.SECONDS));
            }
            return verdicts;
        } finally {
            pool.shutdownNow();
        }
    }
}
