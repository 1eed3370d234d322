package com.signalsync.cloud.model;

import com.signalsync.shared.SyncAnalyzer;
import lombok.Data;

import java.time.Instant;

/**
 * One caller's analysis session. The analyzer inside is not thread-safe, so every use of it
 * synchronizes on the session. Sessions not touched for a while are evicted.
 */
@Data
public class AnalysisSession {
    private final String id;
    private final Instant createdAt;
    private final SyncAnalyzer analyzer;
    private Instant lastAnalyzedAt;
    private int analysisCount;
    private volatile Instant lastAccessedAt;
}
