package com.signalsync.shared.metrics;

import com.signalsync.shared.dsp.SignalOps;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

public final class CrossCorrelationDelay {

    private CrossCorrelationDelay() {
    }

    /**
     * Lag of {@code ppg} relative to {@code ecg} in seconds; positive when the PPG arrives
     * later. Both inputs must already be aligned to the same length. Empty input gives 0.
     */
    public static double estimate(double[] ppg, double[] ecg, double fs) {
        return lagSamples(ppg, ecg) / fs;
    }

    /**
     * Offset in samples of the first global maximum of {@code c(lag) = sum ppg[n + lag] * ecg[n]}
     * over lags {@code -(N-1)..(N-1)}.
     */
    static int lagSamples(double[] ppg, double[] ecg) {
        int n = Math.min(ppg.length, ecg.length);
        if (n == 0) {
            return 0;
        }
        double[] corr = correlate(SignalOps.zscore(ppg), SignalOps.zscore(ecg), n);
        int size = corr.length;
        int bestLag = -(n - 1);
        double best = Double.NEGATIVE_INFINITY;
        for (int lag = -(n - 1); lag <= n - 1; lag++) {
            double value = corr[Math.floorMod(lag, size)];
            if (value > best) {
                best = value;
                bestLag = lag;
            }
        }
        return bestLag;
    }

    // circular correlation through the FFT, padded so that no lag wraps around
    private static double[] correlate(double[] a, double[] b, int n) {
        int size = 1;
        while (size < 2 * n - 1) {
            size <<= 1;
        }
        double[] paddedA = new double[size];
        double[] paddedB = new double[size];
        System.arraycopy(a, 0, paddedA, 0, n);
        System.arraycopy(b, 0, paddedB, 0, n);

        FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
        Complex[] fa = fft.transform(paddedA, TransformType.FORWARD);
        Complex[] fb = fft.transform(paddedB, TransformType.FORWARD);
        Complex[] product = new Complex[size];
        for (int k = 0; k < size; k++) {
            product[k] = fa[k].multiply(fb[k].conjugate());
        }
        Complex[] inverse = fft.transform(product, TransformType.INVERSE);
        double[] corr = new double[size];
        for (int k = 0; k < size; k++) {
            corr[k] = inverse[k].getReal();
        }
        return corr;
    }
}
