package com.signalsync.shared.metrics;

import com.signalsync.shared.domain.PttStats;
import com.signalsync.shared.dsp.SignalOps;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

@Slf4j
public final class PulseTransitTimeMapper {

    public static final double MAX_PTT_SECONDS = 1.5;

    private PulseTransitTimeMapper() {
    }

    /**
     * Transit times in seconds, one per accepted R-peak. Both inputs must be ascending; the
     * PPG cursor only ever moves forward.
     */
    public static double[] map(int[] rPeaks, int[] ppgPeaks, double fs) {
        if (rPeaks.length == 0 || ppgPeaks.length == 0) {
            return new double[0];
        }
        double[] accepted = new double[rPeaks.length];
        int count = 0;
        int j = 0;
        for (int r : rPeaks) {
            while (j < ppgPeaks.length && ppgPeaks[j] <= r) {
                j++;
            }
            if (j == ppgPeaks.length) {
                break;
            }
            double ptt = (ppgPeaks[j] - r) / fs;
            if (ptt > 0.0 && ptt < MAX_PTT_SECONDS) {
                accepted[count++] = ptt;
            }
        }
        return Arrays.copyOf(accepted, count);
    }

    public static PttStats summarize(int[] rPeaks, int[] ppgPeaks, double fs) {
        double[] ptts = map(rPeaks, ppgPeaks, fs);
        if (ptts.length == 0) {
            log.debug("PTT: no R-peak paired with a PPG peak inside {} s", MAX_PTT_SECONDS);
            return PttStats.absent();
        }
        return new PttStats(SignalOps.mean(ptts), SignalOps.std(ptts), ptts.length);
    }
}
