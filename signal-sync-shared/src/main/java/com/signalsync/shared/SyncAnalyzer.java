package com.signalsync.shared;

import com.signalsync.shared.domain.AnalyzerConfig;
import com.signalsync.shared.domain.FilterMode;
import com.signalsync.shared.domain.HeartRateStats;
import com.signalsync.shared.domain.PttStats;
import com.signalsync.shared.domain.ResampledSignal;
import com.signalsync.shared.domain.RoiResult;
import com.signalsync.shared.dsp.ButterworthBandpass;
import com.signalsync.shared.dsp.PeakDetector;
import com.signalsync.shared.dsp.PolyphaseResampler;
import com.signalsync.shared.dsp.SignalOps;
import com.signalsync.shared.error.InvalidRangeException;
import com.signalsync.shared.error.NoRoiConfiguredException;
import com.signalsync.shared.metrics.CrossCorrelationDelay;
import com.signalsync.shared.metrics.HeartRateCalculator;
import com.signalsync.shared.metrics.PulseTransitTimeMapper;
import com.signalsync.shared.metrics.SignalQualityIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;

/**
 * PPG/ECG synchronization analysis over a region of interest.
 *
 * <p>Holds the sampling rate and ROI bounds of one session. Not thread-safe: concurrent
 * callers with independent settings need their own instance.
 */
@Slf4j
public class SyncAnalyzer {

    public static final double ECG_LOW_HZ = 5.0;
    public static final double ECG_HIGH_HZ = 15.0;
    public static final double PPG_LOW_HZ = 0.5;
    public static final double PPG_HIGH_HZ = 5.0;

    private AnalyzerConfig config;

    public SyncAnalyzer() {
        this(AnalyzerConfig.initial());
    }

    public SyncAnalyzer(double samplingRate) {
        this(AnalyzerConfig.initial().withSamplingRate(samplingRate));
    }

    public SyncAnalyzer(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public AnalyzerConfig snapshot() {
        return config;
    }

    /**
     * @throws IllegalArgumentException if {@code fs} is not a finite positive number
     */
    public void setSamplingRate(double fs) {
        config = config.withSamplingRate(fs);
        log.debug("Sampling rate set to {} Hz (config v{})", fs, config.version());
    }

    /**
     * @throws InvalidRangeException if {@code end <= start}; the previous ROI is kept
     */
    public void setRoi(double start, double end) {
        config = config.withRoi(start, end);
        log.debug("ROI set to [{}, {}) s (config v{})", start, end, config.version());
    }

    public void clearRoi() {
        config = config.withRoi(null, null);
    }

    public double[] extractRoi(double[] signal) {
        return extractRoi(config, signal);
    }

    /**
     * Samples of {@code signal} inside the ROI. Bounds become indices by flooring
     * {@code time * fs} and are clamped to the signal, so a ROI overlapping the end of the
     * recording is truncated rather than rejected.
     */
    public static double[] extractRoi(AnalyzerConfig config, double[] signal) {
        if (!config.hasRoi()) {
            throw new NoRoiConfiguredException();
        }
        double fs = config.samplingRate();
        int start = clampIndex(Math.floor(config.roiStart() * fs), signal.length);
        int end = clampIndex(Math.floor(config.roiEnd() * fs), signal.length);
        return Arrays.copyOfRange(signal, start, Math.max(start, end));
    }

    public double[][] alignSignals(double[] a, double[] b) {
        return SignalOps.align(a, b);
    }

    public double[] detrend(double[] x) {
        return SignalOps.detrend(x);
    }

    public double[] zscore(double[] x) {
        return SignalOps.zscore(x);
    }

    public double[] bandpass(double[] x, double lowHz, double highHz) {
        return bandpass(x, lowHz, highHz, ButterworthBandpass.DEFAULT_ORDER);
    }

    public double[] bandpass(double[] x, double lowHz, double highHz, int order) {
        return ButterworthBandpass.design(lowHz, highHz, config.samplingRate(), order).filtfilt(x);
    }

    public ResampledSignal resample(double[] x, double origFs, double targetFs) {
        return PolyphaseResampler.resample(x, origFs, targetFs);
    }

    public int[] detectEcgRPeaks(double[] ecg) {
        return PeakDetector.ECG_R_PEAKS.detect(ecg, config.samplingRate());
    }

    public int[] detectPpgPeaks(double[] ppg) {
        return PeakDetector.PPG_PULSE_PEAKS.detect(ppg, config.samplingRate());
    }

    public HeartRateStats computeHr(int[] peaks) {
        return HeartRateCalculator.compute(peaks, config.samplingRate());
    }

    public double[] mapPtt(int[] rPeaks, int[] ppgPeaks) {
        return PulseTransitTimeMapper.map(rPeaks, ppgPeaks, config.samplingRate());
    }

    public double delayByXcorr(double[] ppg, double[] ecg) {
        return CrossCorrelationDelay.estimate(ppg, ecg, config.samplingRate());
    }

    public RoiResult analyzeRoi(double[] t, double[] ppg, double[] ecg, boolean detrend, String filterMode) {
        return analyzeRoi(config, t, ppg, ecg, detrend, FilterMode.fromLabel(filterMode));
    }

    public RoiResult analyzeRoi(double[] t, double[] ppg, double[] ecg, boolean detrend, FilterMode filterMode) {
        return analyzeRoi(config, t, ppg, ecg, detrend, filterMode);
    }

    /**
     * Runs the full pipeline against an explicit configuration snapshot: ROI extraction,
     * optional detrend, band-pass per {@code filterMode}, peak detection, HR/RR, PTT,
     * cross-correlation delay and SQI. Metrics that lack enough peaks come back absent; they
     * never fail the call.
     *
     * @throws NoRoiConfiguredException if the snapshot has no ROI
     */
    public static RoiResult analyzeRoi(AnalyzerConfig config, double[] t, double[] ppg, double[] ecg,
                                       boolean detrend, FilterMode filterMode) {
        if (!config.hasRoi()) {
            throw new NoRoiConfiguredException();
        }
        double fs = config.samplingRate();

        double[] ppgRoi = extractRoi(config, ppg);
        double[] ecgRoi = extractRoi(config, ecg);
        double[] tRoi = extractRoi(config, t);

        if (detrend) {
            ppgRoi = SignalOps.detrend(ppgRoi);
            ecgRoi = SignalOps.detrend(ecgRoi);
        }

        double[] ppgFiltered = filterMode.isFilterPpg()
            ? ButterworthBandpass.apply(ppgRoi, PPG_LOW_HZ, PPG_HIGH_HZ, fs)
            : ppgRoi;
        double[] ecgFiltered = filterMode.isFilterEcg()
            ? ButterworthBandpass.apply(ecgRoi, ECG_LOW_HZ, ECG_HIGH_HZ, fs)
            : ecgRoi;

        int[] rPeaks = PeakDetector.ECG_R_PEAKS.detect(ecgFiltered, fs);
        int[] ppgPeaks = PeakDetector.PPG_PULSE_PEAKS.detect(ppgFiltered, fs);
        log.debug("ROI [{}, {}) s: {} R-peaks, {} PPG peaks ({})",
            config.roiStart(), config.roiEnd(), rPeaks.length, ppgPeaks.length, filterMode.getLabel());

        HeartRateStats hr = HeartRateCalculator.compute(rPeaks, fs);
        PttStats ptt = PulseTransitTimeMapper.summarize(rPeaks, ppgPeaks, fs);

        double[][] aligned = SignalOps.align(ppgFiltered, ecgFiltered);
        double delay = CrossCorrelationDelay.estimate(aligned[0], aligned[1], fs);

        return RoiResult.builder()
            .startS(config.roiStart())
            .endS(config.roiEnd())
            .sampleCount(tRoi.length)
            .fs(fs)
            .hrBpm(hr.hrBpm())
            .rrMeanS(hr.rrMeanS())
            .rrSdS(hr.rrSdS())
            .pttMeanS(ptt.meanS())
            .pttSdS(ptt.sdS())
            .delayXcorrS(delay)
            .sqi(SignalQualityIndex.compute(ppgFiltered))
            .build();
    }

    private static int clampIndex(double index, int length) {
        if (index <= 0) {
            return 0;
        }
        return (int) Math.min(index, length);
    }
}
