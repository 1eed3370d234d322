package com.signalsync.cloud.service;

import com.signalsync.shared.domain.RoiResult;
import com.signalsync.shared.metrics.SignalQualityIndex;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an analysis result as the one-line status summary shown to operators.
 */
@Service
public class RoiReportService {

    public String summarize(RoiResult result) {
        List<String> parts = new ArrayList<>();
        parts.add(format("ROI %.2f~%.2fs | N=%d | fs=%.2fHz",
            result.getStartS(), result.getEndS(), result.getSampleCount(), result.getFs()));

        parts.add(result.getHrBpm() != null
            ? format("HR = %.1f bpm", result.getHrBpm())
            : "HR = n/a");
        parts.add(result.getRrMeanS() != null
            ? format("RR mean = %.3fs (SD=%.3fs)", result.getRrMeanS(), result.getRrSdS())
            : "RR = n/a");
        parts.add(result.getPttMeanS() != null
            ? format("PTT mean = %.3fs (SD=%.3fs)", result.getPttMeanS(), result.getPttSdS())
            : "PTT = n/a");
        parts.add(format("Delay(xcorr) = %.4fs", result.getDelayXcorrS()));

        Map<String, Double> sqi = result.getSqi();
        parts.add(format("SQI: sat=%.3f, flat=%.3f, snr_like=%.3f",
            sqi.getOrDefault(SignalQualityIndex.SATURATION, 0.0),
            sqi.getOrDefault(SignalQualityIndex.FLATNESS, 0.0),
            sqi.getOrDefault(SignalQualityIndex.SNR_LIKE, 0.0)));

        return String.join(" | ", parts);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
