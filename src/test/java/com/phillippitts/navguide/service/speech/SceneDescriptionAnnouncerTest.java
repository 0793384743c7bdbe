package com.phillippitts.navguide.service.speech;

import com.phillippitts.navguide.config.properties.SpeechProperties;
import com.phillippitts.navguide.exception.SpeechOutputException;
import com.phillippitts.navguide.service.metrics.NavigationMetricsPublisher;
import com.phillippitts.navguide.testutil.EventCapturingPublisher;
import com.phillippitts.navguide.testutil.MutableClock;
import com.phillippitts.navguide.testutil.RecordingSpeechSink;
import com.phillippitts.navguide.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneDescriptionAnnouncerTest {

    private RecordingSpeechSink sink;
    private SceneDescriptionAnnouncer announcer;

    @BeforeEach
    void setUp() {
        sink = new RecordingSpeechSink();
        SpeechArbiter arbiter = new SpeechArbiter(SpeechProperties.defaults(), sink, new SyncExecutor(),
                new MutableClock(), new EventCapturingPublisher(), NavigationMetricsPublisher.NOOP);
        announcer = new SceneDescriptionAnnouncer(arbiter);
    }

    @Test
    void speaksStrippedDescriptionAsInterruptingNavigation() {
        CompletableFuture<Void> done = announcer.announce("  A hallway with a door on the left.  ");

        assertThat(done).isCompleted();
        assertThat(sink.utterances()).singleElement().satisfies(u -> {
            assertThat(u.text()).isEqualTo("A hallway with a door on the left.");
            assertThat(u.tier()).isEqualTo(SpeechTier.NAVIGATION);
            assertThat(u.interrupt()).isTrue();
        });
    }

    @Test
    void rejectsBlankDescription() {
        assertThatThrownBy(() -> announcer.announce(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> announcer.announce(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sinkFailureFailsTheFuture() {
        sink.accept = false;

        CompletableFuture<Void> done = announcer.announce("A busy street.");

        assertThat(done).isCompletedExceptionally();
        assertThatThrownBy(done::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(SpeechOutputException.class);
    }

    @Test
    void loggingSinkAcceptsEverything() {
        LoggingSpeechSink logging = new LoggingSpeechSink();

        assertThat(logging.speak("wall ahead of you, stop", true, SpeechTier.URGENT)).isTrue();
        assertThat(logging.name()).isEqualTo("logging");
        logging.stop();
    }
}
