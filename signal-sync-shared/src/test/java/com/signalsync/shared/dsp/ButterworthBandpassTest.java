package com.signalsync.shared.dsp;

import com.signalsync.shared.Signals;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ButterworthBandpassTest {

    @Test
    void keepsPeakPositionOfAnInBandSine() {
        double fs = 250.0;
        double[] x = Signals.sine(8.0, 0.0, fs, 1000);

        double[] y = ButterworthBandpass.apply(x, 5.0, 15.0, fs);

        int rawPeak = argmax(x, 400, 440);
        int filteredPeak = argmax(y, 400, 440);
        assertThat(filteredPeak).isBetween(rawPeak - 1, rawPeak + 1);
        assertThat(y[filteredPeak]).isCloseTo(1.0, within(0.02));
    }

    @Test
    void attenuatesOutOfBandContent() {
        double fs = 250.0;
        double[] slow = Signals.sine(0.5, 0.0, fs, 2500);

        double[] y = ButterworthBandpass.apply(slow, 5.0, 15.0, fs);

        assertThat(maxAbs(y, 500, 2000)).isLessThan(0.01);
    }

    @Test
    void fourthOrderDesignHasFourSections() {
        assertThat(ButterworthBandpass.design(0.5, 5.0, 128.0, 4).sectionCount()).isEqualTo(4);
        assertThat(ButterworthBandpass.design(5.0, 15.0, 128.0, 3).sectionCount()).isEqualTo(3);
    }

    @Test
    void rejectsCutoffsOutsideTheNyquistBand() {
        assertThatThrownBy(() -> ButterworthBandpass.design(0.0, 5.0, 100.0, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ButterworthBandpass.design(5.0, 50.0, 100.0, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ButterworthBandpass.design(10.0, 5.0, 100.0, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ButterworthBandpass.design(1.0, 5.0, 100.0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shortSegmentsDoNotFail() {
        ButterworthBandpass filter = ButterworthBandpass.design(0.5, 5.0, 128.0, 4);

        assertThat(filter.filtfilt(new double[0])).isEmpty();
        assertThat(filter.filtfilt(new double[] {3.0})).containsExactly(3.0);
        assertThat(filter.filtfilt(new double[] {1.0, 2.0, 3.0, 2.0, 1.0})).hasSize(5);
    }

    private static int argmax(double[] x, int from, int to) {
        int best = from;
        for (int i = from; i < to; i++) {
            if (x[i] > x[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double maxAbs(double[] x, int from, int to) {
        double max = 0.0;
        for (int i = from; i < to; i++) {
            max = Math.max(max, Math.abs(x[i]));
        }
        return max;
    }
}
