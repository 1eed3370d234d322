package com.signalsync.cloud.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalsync.cloud.model.AnalysisSession;
import com.signalsync.shared.domain.AnalyzerConfig;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
    String id,
    double samplingRate,
    Double roiStart,
    Double roiEnd,
    long configVersion,
    int analysisCount,
    Instant createdAt,
    Instant lastAnalyzedAt
) {
    public static SessionView of(AnalysisSession session) {
        AnalyzerConfig config = session.getAnalyzer().snapshot();
        return new SessionView(
            session.getId(),
            config.samplingRate(),
            config.roiStart(),
            config.roiEnd(),
            config.version(),
            session.getAnalysisCount(),
            session.getCreatedAt(),
            session.getLastAnalyzedAt());
    }
}
