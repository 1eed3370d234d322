package com.signalsync.shared.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Outcome of one ROI analysis. Optional metrics are {@code null} when too few events were
 * detected, which is distinct from a measured zero.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoiResult {
    @JsonProperty("start_s")
    double startS;
    @JsonProperty("end_s")
    double endS;
    @JsonProperty("n_samples")
    int sampleCount;
    @JsonProperty("fs")
    double fs;

    @JsonProperty("hr_bpm")
    Double hrBpm;
    @JsonProperty("rr_mean_s")
    Double rrMeanS;
    @JsonProperty("rr_sd_s")
    Double rrSdS;

    @JsonProperty("ptt_mean_s")
    Double pttMeanS;
    @JsonProperty("ptt_sd_s")
    Double pttSdS;

    // signed, positive when the PPG arrives after the ECG
    @JsonProperty("delay_xcorr_s")
    double delayXcorrS;

    @Singular("sqiEntry")
    @JsonProperty("sqi")
    Map<String, Double> sqi;
}
