package com.phillippitts.selfspy.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

    @Test
    void overlapOfContainedInterval() {
        long overlap = TimeUtils.overlapMillis(T0.plusSeconds(10), T0.plusSeconds(20), T0, T0.plusSeconds(60));
        assertThat(overlap).isEqualTo(10_000);
    }

    @Test
    void overlapClipsToWindow() {
        long overlap = TimeUtils.overlapMillis(T0.minusSeconds(30), T0.plusSeconds(30), T0, T0.plusSeconds(60));
        assertThat(overlap).isEqualTo(30_000);
    }

    @Test
    void openIntervalRunsToWindowEnd() {
        long overlap = TimeUtils.overlapMillis(T0.plusSeconds(50), null, T0, T0.plusSeconds(60));
        assertThat(overlap).isEqualTo(10_000);
    }

    @Test
    void disjointIntervalsDoNotOverlap() {
        long overlap = TimeUtils.overlapMillis(T0.minusSeconds(60), T0.minusSeconds(30), T0, T0.plusSeconds(60));
        assertThat(overlap).isZero();
    }
}
