package com.signalsync.cloud.service;

import com.signalsync.shared.domain.RoiResult;
import com.signalsync.shared.metrics.SignalQualityIndex;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoiReportServiceTest {

    private final RoiReportService reportService = new RoiReportService();

    @Test
    void rendersMeasuredValues() {
        RoiResult result = RoiResult.builder()
            .startS(1.0).endS(9.0).sampleCount(2000).fs(250.0)
            .hrBpm(60.24).rrMeanS(0.996).rrSdS(0.004)
            .pttMeanS(0.251).pttSdS(0.0021)
            .delayXcorrS(0.248)
            .sqiEntry(SignalQualityIndex.SATURATION, 0.05)
            .sqiEntry(SignalQualityIndex.FLATNESS, 0.0)
            .sqiEntry(SignalQualityIndex.SNR_LIKE, 12.3449)
            .build();

        assertThat(reportService.summarize(result)).isEqualTo(
            "ROI 1.00~9.00s | N=2000 | fs=250.00Hz"
                + " | HR = 60.2 bpm"
                + " | RR mean = 0.996s (SD=0.004s)"
                + " | PTT mean = 0.251s (SD=0.002s)"
                + " | Delay(xcorr) = 0.2480s"
                + " | SQI: sat=0.050, flat=0.000, snr_like=12.345");
    }

    @Test
    void marksMissingMetricsAsNotAvailable() {
        RoiResult result = RoiResult.builder()
            .startS(0.0).endS(5.0).sampleCount(500).fs(100.0)
            .delayXcorrS(-0.01)
            .sqiEntry(SignalQualityIndex.SATURATION, 1.0)
            .sqiEntry(SignalQualityIndex.FLATNESS, 1.0)
            .sqiEntry(SignalQualityIndex.SNR_LIKE, 0.0)
            .build();

        String line = reportService.summarize(result);

        assertThat(line)
            .contains("HR = n/a")
            .contains("RR = n/a")
            .contains("PTT = n/a")
            .contains("Delay(xcorr) = -0.0100s")
            .contains("SQI: sat=1.000, flat=1.000, snr_like=0.000");
    }
}
