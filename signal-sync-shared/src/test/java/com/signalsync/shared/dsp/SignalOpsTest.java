package com.signalsync.shared.dsp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalOpsTest {

    @Test
    void detrendRemovesALine() {
        double[] x = new double[50];
        for (int i = 0; i < x.length; i++) {
            x[i] = 3.0 + 0.5 * i + (i % 2 == 0 ? 1.0 : -1.0);
        }

        double[] y = SignalOps.detrend(x);

        assertThat(SignalOps.mean(y)).isCloseTo(0.0, within(1e-9));
        assertThat(Math.abs(y[0])).isCloseTo(1.0, within(0.1));
        assertThat(Math.abs(y[49])).isCloseTo(1.0, within(0.1));
    }

    @Test
    void detrendOfTinySegments() {
        assertThat(SignalOps.detrend(new double[0])).isEmpty();
        assertThat(SignalOps.detrend(new double[] {7.0})).containsExactly(0.0);
        assertThat(SignalOps.detrend(new double[] {1.0, 3.0})).containsExactly(new double[] {0.0, 0.0}, within(1e-12));
    }

    @Test
    void zscoreHasZeroMeanAndUnitStd() {
        double[] z = SignalOps.zscore(new double[] {2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0});

        assertThat(SignalOps.mean(z)).isCloseTo(0.0, within(1e-12));
        assertThat(SignalOps.std(z)).isCloseTo(1.0, within(1e-12));
        assertThat(z[0]).isCloseTo(-1.5, within(1e-12));
    }

    @Test
    void zscoreOfFlatSegmentIsZero() {
        assertThat(SignalOps.zscore(new double[] {4.2, 4.2, 4.2})).containsExactly(0.0, 0.0, 0.0);
    }
}
