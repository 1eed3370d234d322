package com.signalsync.shared.metrics;

import com.signalsync.shared.domain.HeartRateStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeartRateCalculatorTest {

    @Test
    void regularBeatsAtOneSecond() {
        HeartRateStats stats = HeartRateCalculator.compute(new int[] {0, 128, 256, 384}, 128.0);

        assertThat(stats.rrMeanS()).isEqualTo(1.0);
        assertThat(stats.hrBpm()).isEqualTo(60.0);
        assertThat(stats.rrSdS()).isEqualTo(0.0);
        assertThat(stats.isPresent()).isTrue();
    }

    @Test
    void fewerThanTwoPeaksIsAbsent() {
        for (int[] peaks : new int[][] {{}, {42}}) {
            HeartRateStats stats = HeartRateCalculator.compute(peaks, 128.0);

            assertThat(stats.hrBpm()).isNull();
            assertThat(stats.rrMeanS()).isNull();
            assertThat(stats.rrSdS()).isNull();
        }
    }

    @Test
    void populationStandardDeviationOfIntervals() {
        // intervals of 0.8 s and 1.2 s
        HeartRateStats stats = HeartRateCalculator.compute(new int[] {0, 80, 200}, 100.0);

        assertThat(stats.rrMeanS()).isCloseTo(1.0, within(1e-12));
        assertThat(stats.rrSdS()).isCloseTo(0.2, within(1e-12));
        assertThat(stats.hrBpm()).isCloseTo(60.0, within(1e-9));
    }
}
