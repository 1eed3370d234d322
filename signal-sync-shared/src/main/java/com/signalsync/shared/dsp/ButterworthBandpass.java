package com.signalsync.shared.dsp;

import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Digital Butterworth band-pass realized as cascaded second-order sections and applied
 * forward and backward, so the output has no phase shift and peak positions stay put.
 */
public final class ButterworthBandpass {

    public static final int DEFAULT_ORDER = 4;

    private static final double REAL_POLE_TOLERANCE = 1e-10;

    // rows of {b0, b1, b2, a1, a2}, a0 is always 1
    private final double[][] sections;
    private final double[][] initialState;

    private ButterworthBandpass(double[][] sections) {
        this.sections = sections;
        this.initialState = steadyState(sections);
    }

    /**
     * Designs a band-pass with cutoffs in Hz.
     *
     * @throws IllegalArgumentException if a cutoff lies outside (0, fs/2), the cutoffs are not
     *                                  increasing, or the order is below 1
     */
    public static ButterworthBandpass design(double lowHz, double highHz, double fs, int order) {
        if (!(fs > 0) || Double.isInfinite(fs)) {
            throw new IllegalArgumentException("Sampling rate must be positive, got " + fs);
        }
        if (order < 1) {
            throw new IllegalArgumentException("Filter order must be at least 1, got " + order);
        }
        double nyquist = 0.5 * fs;
        if (!(lowHz > 0) || !(highHz < nyquist) || !(lowHz < highHz)) {
            throw new IllegalArgumentException(String.format(
                "Cutoffs must satisfy 0 < low < high < %.3f Hz (Nyquist), got [%s, %s]",
                nyquist, lowHz, highHz));
        }

        // pre-warped analog band edges for a bilinear transform at a normalized rate of 2
        double warpedLow = 4.0 * Math.tan(Math.PI * (lowHz / nyquist) / 2.0);
        double warpedHigh = 4.0 * Math.tan(Math.PI * (highHz / nyquist) / 2.0);
        double bandwidth = warpedHigh - warpedLow;
        double center = Math.sqrt(warpedLow * warpedHigh);

        List<Complex> digitalPoles = new ArrayList<>(2 * order);
        Complex analogPoleProduct = Complex.ONE;
        for (int m = -order + 1; m < order; m += 2) {
            Complex prototype = new Complex(0, Math.PI * m / (2.0 * order)).exp().negate();
            Complex shifted = prototype.multiply(bandwidth / 2.0);
            Complex offset = shifted.multiply(shifted).subtract(center * center).sqrt();
            for (Complex analog : new Complex[] {shifted.add(offset), shifted.subtract(offset)}) {
                analogPoleProduct = analogPoleProduct.multiply(new Complex(4.0).subtract(analog));
                digitalPoles.add(new Complex(4.0).add(analog).divide(new Complex(4.0).subtract(analog)));
            }
        }
        // order zeros at z=+1 and order zeros at z=-1, one of each per section
        double gain = Math.pow(bandwidth * 4.0, order) / analogPoleProduct.getReal();
        double sectionGain = Math.pow(gain, 1.0 / order);

        List<double[]> rows = new ArrayList<>(order);
        List<Double> realPoles = new ArrayList<>();
        for (Complex pole : digitalPoles) {
            if (Math.abs(pole.getImaginary()) <= REAL_POLE_TOLERANCE) {
                realPoles.add(pole.getReal());
            } else if (pole.getImaginary() > 0) {
                rows.add(new double[] {sectionGain, 0.0, -sectionGain,
                    -2.0 * pole.getReal(), pole.abs() * pole.abs()});
            }
        }
        realPoles.sort(Double::compare);
        for (int i = 0; i + 1 < realPoles.size(); i += 2) {
            double p1 = realPoles.get(i);
            double p2 = realPoles.get(i + 1);
            rows.add(new double[] {sectionGain, 0.0, -sectionGain, -(p1 + p2), p1 * p2});
        }
        return new ButterworthBandpass(rows.toArray(new double[0][]));
    }

    /**
     * Designs a filter of {@link #DEFAULT_ORDER} and applies it zero-phase.
     */
    public static double[] apply(double[] x, double lowHz, double highHz, double fs) {
        return design(lowHz, highHz, fs, DEFAULT_ORDER).filtfilt(x);
    }

    int sectionCount() {
        return sections.length;
    }

    /**
     * Forward-backward filtering with odd extension at both edges. Segments shorter than two
     * samples are returned unchanged.
     */
    public double[] filtfilt(double[] x) {
        int n = x.length;
        if (n < 2) {
            return Arrays.copyOf(x, n);
        }
        int edge = Math.min(3 * (2 * sections.length + 1), n - 1);
        double[] ext = oddExtend(x, edge);

        double[] forward = filter(ext, ext[0]);
        reverse(forward);
        double[] backward = filter(forward, forward[0]);
        reverse(backward);
        return Arrays.copyOfRange(backward, edge, edge + n);
    }

    private double[] filter(double[] x, double initialValue) {
        double[] y = Arrays.copyOf(x, x.length);
        for (int s = 0; s < sections.length; s++) {
            double[] c = sections[s];
            double z0 = initialState[s][0] * initialValue;
            double z1 = initialState[s][1] * initialValue;
            for (int i = 0; i < y.length; i++) {
                double in = y[i];
                double out = c[0] * in + z0;
                z0 = c[1] * in - c[3] * out + z1;
                z1 = c[2] * in - c[4] * out;
                y[i] = out;
            }
        }
        return y;
    }

    // per-section state for a unit step input, scaled by the DC gain of the preceding sections
    private static double[][] steadyState(double[][] sections) {
        double[][] state = new double[sections.length][2];
        double scale = 1.0;
        for (int s = 0; s < sections.length; s++) {
            double[] c = sections[s];
            double b0 = c[0], b1 = c[1], b2 = c[2], a1 = c[3], a2 = c[4];
            double rhs0 = b1 - a1 * b0;
            double rhs1 = b2 - a2 * b0;
            double det = 1.0 + a1 + a2;
            double z0 = (rhs0 + rhs1) / det;
            double z1 = rhs1 - a2 * z0;
            state[s][0] = scale * z0;
            state[s][1] = scale * z1;
            scale *= (b0 + b1 + b2) / (1.0 + a1 + a2);
        }
        return state;
    }

    private static double[] oddExtend(double[] x, int edge) {
        int n = x.length;
        double[] ext = new double[n + 2 * edge];
        for (int i = 0; i < edge; i++) {
            ext[i] = 2.0 * x[0] - x[edge - i];
            ext[n + edge + i] = 2.0 * x[n - 1] - x[n - 2 - i];
        }
        System.arraycopy(x, 0, ext, edge, n);
        return ext;
    }

    private static void reverse(double[] a) {
        for (int i = 0, j = a.length - 1; i < j; i++, j--) {
            double tmp = a[i];
            a[i] = a[j];
            a[j] = tmp;
        }
    }
}
