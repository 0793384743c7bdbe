package com.phillippitts.navguide.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ZoneCoverageTest {

    @Test
    void returnsCoveragePerZone() {
        ZoneCoverage coverage = new ZoneCoverage(0.1, 0.7, 0.3);

        assertThat(coverage.of(Zone.LEFT)).isEqualTo(0.1);
        assertThat(coverage.of(Zone.CENTER)).isEqualTo(0.7);
        assertThat(coverage.of(Zone.RIGHT)).isEqualTo(0.3);
        assertThat(coverage.dominantZone()).isEqualTo(Zone.CENTER);
    }

    @Test
    void leftWinsTiesForDominantZone() {
        assertThat(ZoneCoverage.NONE.dominantZone()).isEqualTo(Zone.LEFT);
        assertThat(new ZoneCoverage(0.0, 0.5, 0.5).dominantZone()).isEqualTo(Zone.CENTER);
    }

    @Test
    void directionMirrorsZone() {
        assertThat(Direction.of(Zone.LEFT)).isEqualTo(Direction.LEFT);
        assertThat(Direction.of(Zone.CENTER)).isEqualTo(Direction.CENTER);
        assertThat(Direction.of(Zone.RIGHT)).isEqualTo(Direction.RIGHT);
    }

    @Test
    void frameAndAnalysisCopyTheirCollections() {
        List<RawDetection> raw = new ArrayList<>();
        raw.add(RawDetection.withoutDepth("chair", 0.9, 0, 0, 10, 10));
        Frame frame = new Frame(100, 100, raw);
        raw.clear();

        assertThat(frame.detections()).hasSize(1);

        Set<Zone> zones = new HashSet<>(Set.of(Zone.LEFT));
        PartitionAnalysis analysis = new PartitionAnalysis(
                new Detection("chair", 0.9, 0.1, 0.5, 0.1, 0.1, 1.0), zones, Zone.LEFT, 0.1, ZoneCoverage.NONE);
        zones.add(Zone.RIGHT);

        assertThat(analysis.overlaps(Zone.LEFT)).isTrue();
        assertThat(analysis.overlaps(Zone.RIGHT)).isFalse();
    }
}
