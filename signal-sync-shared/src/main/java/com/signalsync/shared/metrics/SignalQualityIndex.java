package com.signalsync.shared.metrics;

import com.signalsync.shared.dsp.SignalOps;
import org.apache.commons.math3.stat.StatUtils;

import java.util.LinkedHashMap;
import java.util.Map;

public final class SignalQualityIndex {

    public static final String SATURATION = "saturation";
    public static final String FLATNESS = "flatness";
    public static final String SNR_LIKE = "snr_like";

    static final double RAIL_FRACTION = 0.01;
    static final double FLAT_STEP = 1e-4;
    static final double EPSILON = 1e-9;

    private SignalQualityIndex() {
    }

    /**
     * saturation: share of samples within 1% of the range from either extreme.
     * flatness: share of steps smaller than 1e-4.
     * snr_like: variance over mean absolute step, higher for smooth high-amplitude signals.
     */
    public static Map<String, Double> compute(double[] x) {
        Map<String, Double> sqi = new LinkedHashMap<>();
        if (x.length == 0) {
            sqi.put(SATURATION, 0.0);
            sqi.put(FLATNESS, 0.0);
            sqi.put(SNR_LIKE, 0.0);
            return sqi;
        }
        double max = StatUtils.max(x);
        double min = StatUtils.min(x);
        double range = max - min + EPSILON;
        double upperRail = max - RAIL_FRACTION * range;
        double lowerRail = min + RAIL_FRACTION * range;
        int railed = 0;
        for (double v : x) {
            if (v > upperRail || v < lowerRail) {
                railed++;
            }
        }

        int steps = x.length - 1;
        int flatSteps = 0;
        double stepSum = 0.0;
        for (int i = 1; i < x.length; i++) {
            double step = Math.abs(x[i] - x[i - 1]);
            if (step < FLAT_STEP) {
                flatSteps++;
            }
            stepSum += step;
        }

        sqi.put(SATURATION, (double) railed / x.length);
        sqi.put(FLATNESS, steps == 0 ? 0.0 : (double) flatSteps / steps);
        sqi.put(SNR_LIKE, steps == 0 ? 0.0 : SignalOps.variance(x) / (stepSum / steps + EPSILON));
        return sqi;
    }
}
