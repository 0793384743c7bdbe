package com.phillippitts.navguide.exception;

import com.phillippitts.navguide.service.speech.SpeechTier;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void navGuideExceptionShouldIncludeMessage() {
        NavGuideException ex = new NavGuideException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void navGuideExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        NavGuideException ex = new NavGuideException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidFrameExceptionShouldIncludeDimensionsAndReason() {
        InvalidFrameException ex = new InvalidFrameException(0, 480, "image dimensions must be positive");

        assertThat(ex.getMessage()).contains("0x480").contains("image dimensions must be positive");
        assertThat(ex.getImageWidth()).isZero();
        assertThat(ex.getImageHeight()).isEqualTo(480);
        assertThat(ex.getReason()).isEqualTo("image dimensions must be positive");
    }

    @Test
    void speechOutputExceptionShouldIncludeTier() {
        RuntimeException cause = new RuntimeException("device gone");
        SpeechOutputException ex = new SpeechOutputException("sink failed", SpeechTier.URGENT, cause);

        assertThat(ex.getMessage()).contains("sink failed").contains("URGENT");
        assertThat(ex.getTier()).isEqualTo(SpeechTier.URGENT);
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allExceptionsShouldBeRuntimeExceptions() {
        assertThat(new NavGuideException("test")).isInstanceOf(RuntimeException.class);
        assertThat(new InvalidFrameException("test")).isInstanceOf(NavGuideException.class);
        assertThat(new SpeechOutputException("test", SpeechTier.NAVIGATION)).isInstanceOf(NavGuideException.class);
    }
}
