package com.signalsync.shared.dsp;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Local-maximum search with a refractory spacing and a prominence floor, run on the
 * z-scored segment.
 */
@Getter
public final class PeakDetector {

    // ~250 ms refractory period
    public static final PeakDetector ECG_R_PEAKS = new PeakDetector(0.25, 1.0);

    public static final PeakDetector PPG_PULSE_PEAKS = new PeakDetector(0.30, 0.3);

    private final double minSpacingSeconds;
    private final double minProminence;

    public PeakDetector(double minSpacingSeconds, double minProminence) {
        this.minSpacingSeconds = minSpacingSeconds;
        this.minProminence = minProminence;
    }

    /**
     * @return ascending sample indices, empty when no peak qualifies
     */
    public int[] detect(double[] segment, double fs) {
        double[] z = SignalOps.zscore(segment);
        int distance = Math.max(1, (int) (minSpacingSeconds * fs));
        int[] candidates = localMaxima(z);
        int[] spaced = selectByDistance(z, candidates, distance);
        return selectByProminence(z, spaced, minProminence);
    }

    /**
     * Indices of samples strictly greater than their left neighbour and greater than the first
     * differing sample to the right. Flat tops resolve to their middle sample (rounded down).
     */
    static int[] localMaxima(double[] x) {
        List<Integer> peaks = new ArrayList<>();
        int i = 1;
        int last = x.length - 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    int right = ahead - 1;
                    peaks.add((i + right) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return peaks.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Keeps the highest peaks first and drops any neighbour closer than {@code distance}
     * samples to an already kept peak.
     */
    static int[] selectByDistance(double[] x, int[] peaks, int distance) {
        int count = peaks.length;
        if (count == 0 || distance <= 1) {
            return peaks;
        }
        boolean[] keep = new boolean[count];
        Arrays.fill(keep, true);

        Integer[] byHeight = new Integer[count];
        for (int i = 0; i < count; i++) {
            byHeight[i] = i;
        }
        Arrays.sort(byHeight, Comparator.comparingDouble(i -> x[peaks[i]]));

        for (int r = count - 1; r >= 0; r--) {
            int j = byHeight[r];
            if (!keep[j]) {
                continue;
            }
            for (int k = j - 1; k >= 0 && peaks[j] - peaks[k] < distance; k--) {
                keep[k] = false;
            }
            for (int k = j + 1; k < count && peaks[k] - peaks[j] < distance; k++) {
                keep[k] = false;
            }
        }

        int[] kept = new int[count];
        int n = 0;
        for (int i = 0; i < count; i++) {
            if (keep[i]) {
                kept[n++] = peaks[i];
            }
        }
        return Arrays.copyOf(kept, n);
    }

    static int[] selectByProminence(double[] x, int[] peaks, double minProminence) {
        int[] kept = new int[peaks.length];
        int n = 0;
        for (int peak : peaks) {
            if (prominence(x, peak) >= minProminence) {
                kept[n++] = peak;
            }
        }
        return Arrays.copyOf(kept, n);
    }

    /**
     * Height of a peak above the higher of the two minima found by walking outwards until a
     * higher sample or the segment edge is reached.
     */
    static double prominence(double[] x, int peak) {
        double height = x[peak];

        double leftMin = height;
        for (int i = peak; i >= 0 && x[i] <= height; i--) {
            leftMin = Math.min(leftMin, x[i]);
        }
        double rightMin = height;
        for (int i = peak; i < x.length && x[i] <= height; i++) {
            rightMin = Math.min(rightMin, x[i]);
        }
        return height - Math.max(leftMin, rightMin);
    }
}
