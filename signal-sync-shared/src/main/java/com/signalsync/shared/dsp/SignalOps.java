package com.signalsync.shared.dsp;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.Arrays;

public final class SignalOps {

    static final double FLAT_STD = 1e-12;

    private SignalOps() {
    }

    public static double mean(double[] x) {
        return x.length == 0 ? Double.NaN : StatUtils.mean(x);
    }

    // population
    public static double std(double[] x) {
        return Math.sqrt(variance(x));
    }

    public static double variance(double[] x) {
        if (x.length == 0) {
            return Double.NaN;
        }
        return StatUtils.populationVariance(x);
    }

    /**
     * (x - mean) / std. A segment whose std is at most 1e-12 is divided by 1 instead, so a
     * flat segment becomes all zeros.
     */
    public static double[] zscore(double[] x) {
        if (x.length == 0) {
            return new double[0];
        }
        double m = mean(x);
        double s = std(x);
        double divisor = s > FLAT_STD ? s : 1.0;
        double[] z = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            z[i] = (x[i] - m) / divisor;
        }
        return z;
    }

    public static double[] detrend(double[] x) {
        int n = x.length;
        if (n < 2) {
            // a single sample is its own trend
            return new double[n];
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, x[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = x[i] - (intercept + slope * i);
        }
        return out;
    }

    // truncates both to the shorter length
    public static double[][] align(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        return new double[][] {Arrays.copyOf(a, n), Arrays.copyOf(b, n)};
    }
}
