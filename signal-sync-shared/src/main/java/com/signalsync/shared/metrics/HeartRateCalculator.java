package com.signalsync.shared.metrics;

import com.signalsync.shared.domain.HeartRateStats;
import com.signalsync.shared.dsp.SignalOps;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class HeartRateCalculator {

    private HeartRateCalculator() {
    }

    public static HeartRateStats compute(int[] peaks, double fs) {
        if (peaks.length < 2) {
            log.debug("HR: insufficient peaks ({})", peaks.length);
            return HeartRateStats.absent();
        }
        double[] rr = new double[peaks.length - 1];
        for (int i = 1; i < peaks.length; i++) {
            rr[i - 1] = (peaks[i] - peaks[i - 1]) / fs;
        }
        double rrMean = SignalOps.mean(rr);
        double rrSd = SignalOps.std(rr);
        Double hr = rrMean > 0 ? 60.0 / rrMean : null;
        return new HeartRateStats(hr, rrMean, rrSd);
    }
}
