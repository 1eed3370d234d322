package com.signalsync.shared.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AnalysisRequest {
    private double[] t;
    private double[] ppg;
    private double[] ecg;
    // null leaves the choice to the caller's defaults
    private Boolean detrend;
    private String filterMode;
}
