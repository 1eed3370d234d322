package com.signalsync.shared.dsp;

import com.signalsync.shared.domain.ResampledSignal;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.fraction.Fraction;
import org.apache.commons.math3.fraction.FractionConversionException;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Arrays;

/**
 * Rational-ratio sample rate conversion: upsample by {@code up}, low-pass with a Kaiser
 * windowed FIR, downsample by {@code down}. Only the output samples that survive decimation
 * are computed.
 */
@Slf4j
public final class PolyphaseResampler {

    static final double RATE_EPSILON = 1e-6;
    static final double KAISER_BETA = 5.0;
    static final int HALF_LENGTH_PER_RATE = 10;
    static final int MAX_DENOMINATOR = 1000;
    // caps the FIR at 2 * 10 * 100_000 + 1 taps
    static final int MAX_RATE_FACTOR = 100_000;

    private PolyphaseResampler() {
    }

    /**
     * Converts {@code x} from {@code origFs} to {@code targetFs}. Identity when the two rates
     * differ by less than 1e-6 Hz.
     */
    public static ResampledSignal resample(double[] x, double origFs, double targetFs) {
        if (!(origFs > 0) || !(targetFs > 0) || Double.isInfinite(origFs) || Double.isInfinite(targetFs)) {
            throw new IllegalArgumentException(
                "Sampling rates must be positive, got " + origFs + " -> " + targetFs);
        }
        if (Math.abs(origFs - targetFs) < RATE_EPSILON) {
            return new ResampledSignal(Arrays.copyOf(x, x.length), origFs);
        }
        int[] ratio = ratio(origFs, targetFs);
        log.debug("Resampling {} samples {} Hz -> {} Hz (up={}, down={})",
            x.length, origFs, targetFs, ratio[0], ratio[1]);
        return new ResampledSignal(resamplePoly(x, ratio[0], ratio[1]), targetFs);
    }

    /**
     * {up, down} in lowest terms such that targetFs / origFs == up / down.
     *
     * @throws IllegalArgumentException if either factor would exceed {@link #MAX_RATE_FACTOR}
     */
    static int[] ratio(double origFs, double targetFs) {
        long up;
        long down;
        long orig = Math.round(origFs);
        long target = Math.round(targetFs);
        if (Math.abs(orig - origFs) < RATE_EPSILON && Math.abs(target - targetFs) < RATE_EPSILON) {
            long g = ArithmeticUtils.gcd(orig, target);
            up = target / g;
            down = orig / g;
        } else {
            double quotient = targetFs / origFs;
            if (!(quotient < MAX_RATE_FACTOR)) {
                throw unsupportedRatio(origFs, targetFs);
            }
            Fraction fraction;
            try {
                fraction = new Fraction(quotient, MAX_DENOMINATOR);
            } catch (FractionConversionException e) {
                throw new IllegalArgumentException(
                    "Rate ratio " + targetFs + "/" + origFs + " has no rational approximation", e);
            }
            if (fraction.getNumerator() < 1) {
                throw new IllegalArgumentException(
                    "Rate ratio " + targetFs + "/" + origFs + " is too small to represent");
            }
            up = fraction.getNumerator();
            down = fraction.getDenominator();
        }
        if (up > MAX_RATE_FACTOR || down > MAX_RATE_FACTOR) {
            throw unsupportedRatio(origFs, targetFs);
        }
        return new int[] {(int) up, (int) down};
    }

    private static IllegalArgumentException unsupportedRatio(double origFs, double targetFs) {
        return new IllegalArgumentException(String.format(
            "Rate ratio %s/%s needs a factor above %d", targetFs, origFs, MAX_RATE_FACTOR));
    }

    static double[] resamplePoly(double[] x, int up, int down) {
        int n = x.length;
        int outLength = (int) ((long) n * up / down + (((long) n * up) % down == 0 ? 0 : 1));
        int halfLength = HALF_LENGTH_PER_RATE * Math.max(up, down);
        double[] h = lowPass(2 * halfLength + 1, 1.0 / Math.max(up, down));
        for (int i = 0; i < h.length; i++) {
            h[i] *= up;
        }

        double[] y = new double[outLength];
        for (int m = 0; m < outLength; m++) {
            // position of this output on the upsampled grid, shifted by the filter's group delay
            long center = (long) m * down + halfLength;
            long firstInput = Math.max(0, ceilDiv(center - (h.length - 1), up));
            long lastInput = Math.min(n - 1, center / up);
            double acc = 0.0;
            for (long k = firstInput; k <= lastInput; k++) {
                acc += x[(int) k] * h[(int) (center - k * up)];
            }
            y[m] = acc;
        }
        return y;
    }

    /**
     * Kaiser-windowed sinc low-pass with the cutoff given relative to Nyquist, scaled to unit DC
     * gain.
     */
    static double[] lowPass(int taps, double cutoff) {
        double alpha = (taps - 1) / 2.0;
        double[] h = new double[taps];
        double denominator = besselI0(KAISER_BETA);
        double sum = 0.0;
        for (int i = 0; i < taps; i++) {
            double m = i - alpha;
            double ratio = 2.0 * i / (taps - 1) - 1.0;
            double window = besselI0(KAISER_BETA * Math.sqrt(Math.max(0.0, 1.0 - ratio * ratio))) / denominator;
            h[i] = cutoff * sinc(cutoff * m) * window;
            sum += h[i];
        }
        for (int i = 0; i < taps; i++) {
            h[i] /= sum;
        }
        return h;
    }

    private static double sinc(double v) {
        if (v == 0.0) {
            return 1.0;
        }
        double arg = Math.PI * v;
        return Math.sin(arg) / arg;
    }

    // modified Bessel function of the first kind, order 0, by power series
    static double besselI0(double v) {
        double sum = 1.0;
        double term = 1.0;
        double half = v / 2.0;
        for (int k = 1; k < 50; k++) {
            term *= (half / k) * (half / k);
            sum += term;
            if (term < sum * 1e-17) {
                break;
            }
        }
        return sum;
    }

    private static long ceilDiv(long a, long b) {
        return -Math.floorDiv(-a, b);
    }
}
