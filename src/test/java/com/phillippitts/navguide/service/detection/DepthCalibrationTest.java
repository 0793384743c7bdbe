package com.phillippitts.navguide.service.detection;

import com.phillippitts.navguide.config.properties.DepthProperties;
import com.phillippitts.navguide.domain.DistanceCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DepthCalibrationTest {

    private final DepthCalibration calibration = new DepthCalibration(DepthProperties.defaults());

    @Test
    void dividesRelativeDepthByScaleFactor() {
        assertThat(calibration.toMeters(300.0)).isEqualTo(2.0);
    }

    @Test
    void clampsToConfiguredRange() {
        assertThat(calibration.toMeters(1.0)).isEqualTo(0.1);
        assertThat(calibration.toMeters(1_000_000.0)).isEqualTo(10.0);
        assertThat(calibration.clampMeters(25.0)).isEqualTo(10.0);
        assertThat(calibration.clampMeters(0.0)).isEqualTo(0.1);
    }

    @Test
    void unusableDepthYieldsNull() {
        assertThat(calibration.toMeters(Double.NaN)).isNull();
        assertThat(calibration.toMeters(Double.POSITIVE_INFINITY)).isNull();
        assertThat(calibration.toMeters(-5.0)).isNull();
        assertThat(calibration.clampMeters(Double.NaN)).isNull();
    }

    @Test
    void thresholdsAreExclusiveUpperBounds() {
        assertThat(calibration.category(0.5)).isEqualTo(DistanceCategory.VERY_CLOSE);
        assertThat(calibration.category(1.0)).isEqualTo(DistanceCategory.CLOSE);
        assertThat(calibration.category(1.99)).isEqualTo(DistanceCategory.CLOSE);
        assertThat(calibration.category(2.0)).isEqualTo(DistanceCategory.MEDIUM);
        assertThat(calibration.category(4.0)).isEqualTo(DistanceCategory.FAR);
    }
}
