package com.phillippitts.navguide.service.speech;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ExponentialSmootherTest {

    @Test
    void firstSampleIsReturnedUnchanged() {
        ExponentialSmoother smoother = new ExponentialSmoother(0.35);

        assertThat(smoother.current()).isNull();
        assertThat(smoother.smooth(2.0)).isEqualTo(2.0);
    }

    @Test
    void blendsNewSamplesByAlpha() {
        ExponentialSmoother smoother = new ExponentialSmoother(0.5);
        smoother.smooth(2.0);

        assertThat(smoother.smooth(1.0)).isCloseTo(1.5, within(1e-9));
        assertThat(smoother.smooth(1.0)).isCloseTo(1.25, within(1e-9));
    }

    @Test
    void resetForgetsHistory() {
        ExponentialSmoother smoother = new ExponentialSmoother(0.5);
        smoother.smooth(4.0);
        smoother.reset();

        assertThat(smoother.smooth(1.0)).isEqualTo(1.0);
    }

    @Test
    void rejectsAlphaOutsideRange() {
        assertThatThrownBy(() -> new ExponentialSmoother(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialSmoother(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new ExponentialSmoother(1.0).smooth(3.0)).isEqualTo(3.0);
    }
}
