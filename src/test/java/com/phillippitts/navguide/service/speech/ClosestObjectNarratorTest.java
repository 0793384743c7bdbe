package com.phillippitts.navguide.service.speech;

import com.phillippitts.navguide.config.properties.SpeechProperties;
import com.phillippitts.navguide.domain.Detection;
import com.phillippitts.navguide.service.gate.GateVerdict;
import com.phillippitts.navguide.service.gate.SuppressionReason;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.testutil.Detections;
import com.phillippitts.navguide.testutil.EventCapturingPublisher;
import com.phillippitts.navguide.testutil.MutableClock;
import com.phillippitts.navguide.testutil.RecordingSpeechSink;
import com.phillippitts.navguide.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClosestObjectNarratorTest {

    private MutableClock clock;
    private RecordingSpeechSink sink;
    private SpeechArbiter arbiter;
    private ClosestObjectNarrator narrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sink = new RecordingSpeechSink();
        arbiter = new SpeechArbiter(SpeechProperties.defaults(), sink, new SyncExecutor(), clock,
                new EventCapturingPublisher(), NavigationMetricsPublisher.NOOP);
        narrator = new ClosestObjectNarrator(SpeechProperties.defaults(), arbiter, clock,
                NavigationMetricsPublisher.NOOP);
    }

    private GateVerdict frame(Detection... detections) {
        return narrator.process(List.of(detections));
    }

    @Test
    void narratesClosestConfidentObjectWithDistance() {
        GateVerdict v = frame(
                Detections.at("chair", 0.2, 0.2, 2.0),
                Detections.at("person", 0.3, 0.5, 0.2, 1.0),
                Detections.at("door", 0.5, 0.2, null),
                Detections.at("table", 0.8, 0.2, 3.0));

        assertThat(v.announcement()).isEqualTo("chair, about 2.0 meters to your left");
        assertThat(sink.utterances()).singleElement().satisfies(u -> {
            assertThat(u.tier()).isEqualTo(SpeechTier.INFORMATION);
            assertThat(u.interrupt()).isFalse();
        });
    }

    @Test
    void nothingToNarrate() {
        assertThat(frame().reason()).isEqualTo(SuppressionReason.NO_CANDIDATE);
        assertThat(frame(Detections.at("door", 0.5, 0.2, null)).reason()).isEqualTo(SuppressionReason.NO_CANDIDATE);
    }

    @Test
    void cooldownBetweenNarrations() {
        frame(Detections.at("chair", 0.5, 0.2, 2.0));
        clock.advanceMillis(1199);

        assertThat(frame(Detections.at("table", 0.5, 0.2, 1.0)).reason())
                .isEqualTo(SuppressionReason.NARRATOR_COOLDOWN);
    }

    @Test
    void smallDistanceDriftIsNotRepeated() {
        frame(Detections.at("chair", 0.5, 0.2, 2.0));
        clock.advanceMillis(1200);

        assertThat(frame(Detections.at("chair", 0.5, 0.2, 2.1)).reason())
                .isEqualTo(SuppressionReason.NARRATOR_HYSTERESIS);
    }

    @Test
    void largeSmoothedChangeIsNarrated() {
        frame(Detections.at("chair", 0.5, 0.2, 2.0));
        clock.advanceMillis(1200);

        GateVerdict v = frame(Detections.at("chair", 0.5, 0.2, 4.0));

        assertThat(v.announcement()).isEqualTo("chair, about 2.7 meters ahead");
    }

    @Test
    void newLabelIsNarratedAfterCooldown() {
        frame(Detections.at("chair", 0.5, 0.2, 2.0));
        clock.advanceMillis(1200);

        assertThat(frame(Detections.at("bench", 0.9, 0.2, 2.0)).announcement())
                .isEqualTo("bench, about 2.0 meters to your right");
    }

    @Test
    void mutedWhileNavigationSpeaks() {
        arbiter.request("wall ahead of you, stop", SpeechTier.URGENT, true);

        assertThat(frame(Detections.at("chair", 0.5, 0.2, 2.0)).reason())
                .isEqualTo(SuppressionReason.INFORMATION_SUPPRESSED);

        clock.advanceMillis(1500);
        assertThat(frame(Detections.at("chair", 0.5, 0.2, 2.0)).allowed()).isTrue();
    }

    @Test
    void resetAllowsImmediateNarration() {
        frame(Detections.at("chair", 0.5, 0.2, 2.0));
        narrator.reset();

        assertThat(frame(Detections.at("chair", 0.5, 0.2, 2.0)).allowed()).isTrue();
    }

    @Test
    void directionFromHorizontalCenter() {
        assertThat(ClosestObjectNarrator.direction(0.1)).isEqualTo("to your left");
        assertThat(ClosestObjectNarrator.direction(0.5)).isEqualTo("ahead");
        assertThat(ClosestObjectNarrator.direction(0.9)).isEqualTo("to your right");
    }
}
