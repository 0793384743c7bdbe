package com.phillippitts.navguide.service.decision;

import com.phillippitts.navguide.domain.Direction;
import com.phillippitts.navguide.domain.DistanceCategory;
import com.phillippitts.navguide.domain.Guidance;
import com.phillippitts.navguide.domain.NavigationDecision;
import com.phillippitts.navguide.service.speech.SpeechTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NavigationPhrasesTest {

    @Test
    void partitionPhrases() {
        assertThat(NavigationPhrases.text(NavigationDecision.STOP, "wall")).isEqualTo("wall ahead of you, stop");
        assertThat(NavigationPhrases.text(NavigationDecision.STEP_LEFT, "chair"))
                .isEqualTo("chair ahead of you, move left");
        assertThat(NavigationPhrases.text(NavigationDecision.STEP_RIGHT, "table"))
                .isEqualTo("table ahead of you, move right");
        assertThat(NavigationPhrases.text(NavigationDecision.GO_STRAIGHT, "bin"))
                .isEqualTo("bin ahead of you, move straight");
    }

    @Test
    void onlyStopIsUrgent() {
        assertThat(NavigationPhrases.tierFor(NavigationDecision.STOP)).isEqualTo(SpeechTier.URGENT);
        assertThat(NavigationPhrases.tierFor(NavigationDecision.STEP_LEFT)).isEqualTo(SpeechTier.NAVIGATION);
        assertThat(NavigationPhrases.isUrgent(NavigationDecision.GO_STRAIGHT)).isFalse();
    }

    @Test
    void legacyPhrasesAndTiers() {
        Guidance veryClose = new Guidance("person", Direction.LEFT, DistanceCategory.VERY_CLOSE, 30);
        Guidance medium = new Guidance("car", Direction.CENTER, DistanceCategory.MEDIUM, 12);

        assertThat(NavigationPhrases.text(veryClose)).isEqualTo("person to your left, very close, stop");
        assertThat(NavigationPhrases.text(medium)).isEqualTo("car ahead, approaching");
        assertThat(NavigationPhrases.tierFor(veryClose)).isEqualTo(SpeechTier.URGENT);
        assertThat(NavigationPhrases.tierFor(medium)).isEqualTo(SpeechTier.NAVIGATION);
    }
}
