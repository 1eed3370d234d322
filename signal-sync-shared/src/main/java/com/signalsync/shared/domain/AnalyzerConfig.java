package com.signalsync.shared.domain;

import com.signalsync.shared.error.InvalidRangeException;

/**
 * Immutable snapshot of an analyzer's sampling rate and ROI bounds.
 * Each change produces a new snapshot with an incremented version.
 *
 * @throws IllegalArgumentException if the sampling rate is not a finite positive number or only
 *                                  one ROI bound is set
 * @throws InvalidRangeException    if both bounds are set and {@code roiEnd <= roiStart}
 */
public record AnalyzerConfig(
    long version,
    double samplingRate,
    Double roiStart,
    Double roiEnd
) {
    public static final double DEFAULT_SAMPLING_RATE = 128.0;

    public AnalyzerConfig {
        if (!(samplingRate > 0) || Double.isInfinite(samplingRate)) {
            throw new IllegalArgumentException("Sampling rate must be positive, got " + samplingRate);
        }
        if ((roiStart == null) != (roiEnd == null)) {
            throw new IllegalArgumentException(
                "ROI bounds must be set together, got [" + roiStart + ", " + roiEnd + "]");
        }
        if (roiStart != null && !(roiEnd > roiStart)) {
            throw new InvalidRangeException(roiStart, roiEnd);
        }
    }

    public static AnalyzerConfig initial() {
        return new AnalyzerConfig(0L, DEFAULT_SAMPLING_RATE, null, null);
    }

    public boolean hasRoi() {
        return roiStart != null;
    }

    public AnalyzerConfig withSamplingRate(double fs) {
        return new AnalyzerConfig(version + 1, fs, roiStart, roiEnd);
    }

    public AnalyzerConfig withRoi(Double start, Double end) {
        return new AnalyzerConfig(version + 1, samplingRate, start, end);
    }
}
