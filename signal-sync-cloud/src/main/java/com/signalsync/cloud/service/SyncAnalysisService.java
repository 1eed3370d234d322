package com.signalsync.cloud.service;

import com.signalsync.cloud.dto.SessionView;
import com.signalsync.cloud.model.AnalysisSession;
import com.signalsync.cloud.repository.AnalysisSessionRepository;
import com.signalsync.shared.SyncAnalyzer;
import com.signalsync.shared.domain.AnalysisRequest;
import com.signalsync.shared.domain.FilterMode;
import com.signalsync.shared.domain.ResampledSignal;
import com.signalsync.shared.domain.RoiResult;
import com.signalsync.shared.dsp.PolyphaseResampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
public class SyncAnalysisService {

    private final AnalysisSessionRepository repository;
    private final double defaultSamplingRate;
    private final FilterMode defaultFilterMode;
    private final boolean defaultDetrend;
    private final Duration idleTimeout;

    public SyncAnalysisService(AnalysisSessionRepository repository,
                               @Value("${signal-sync.default-sampling-rate:128.0}") double defaultSamplingRate,
                               @Value("${signal-sync.default-filter-mode:default}") String defaultFilterMode,
                               @Value("${signal-sync.default-detrend:true}") boolean defaultDetrend,
                               @Value("${signal-sync.session-idle-minutes:30}") long idleMinutes) {
        this.repository = repository;
        this.defaultSamplingRate = defaultSamplingRate;
        this.defaultFilterMode = FilterMode.fromLabel(defaultFilterMode);
        this.defaultDetrend = defaultDetrend;
        this.idleTimeout = Duration.ofMinutes(idleMinutes);
    }

    public SessionView createSession() {
        AnalysisSession session = new AnalysisSession(
            UUID.randomUUID().toString(), Instant.now(), new SyncAnalyzer(defaultSamplingRate));
        session.setLastAccessedAt(session.getCreatedAt());
        repository.save(session);
        log.info("Created session {} ({} open)", session.getId(), repository.count());
        return view(session);
    }

    public SessionView getSession(String id) {
        return view(find(id));
    }

    public void deleteSession(String id) {
        if (!repository.delete(id)) {
            throw new SessionNotFoundException(id);
        }
        log.info("Closed session {}", id);
    }

    public SessionView setSamplingRate(String id, double samplingRate) {
        AnalysisSession session = find(id);
        synchronized (session) {
            session.getAnalyzer().setSamplingRate(samplingRate);
            return SessionView.of(session);
        }
    }

    public SessionView setRoi(String id, double start, double end) {
        AnalysisSession session = find(id);
        synchronized (session) {
            session.getAnalyzer().setRoi(start, end);
            return SessionView.of(session);
        }
    }

    public SessionView clearRoi(String id) {
        AnalysisSession session = find(id);
        synchronized (session) {
            session.getAnalyzer().clearRoi();
            return SessionView.of(session);
        }
    }

    public RoiResult analyze(String id, AnalysisRequest request) {
        requireSignals(request);
        AnalysisSession session = find(id);
        synchronized (session) {
            FilterMode mode = request.getFilterMode() != null
                ? FilterMode.fromLabel(request.getFilterMode())
                : defaultFilterMode;
            boolean detrend = request.getDetrend() != null ? request.getDetrend() : defaultDetrend;
            RoiResult result = session.getAnalyzer().analyzeRoi(
                request.getT(), request.getPpg(), request.getEcg(), detrend, mode);
            session.setLastAnalyzedAt(Instant.now());
            session.setAnalysisCount(session.getAnalysisCount() + 1);
            log.info("Session {}: analyzed ROI [{}, {}) s, {} samples", id,
                result.getStartS(), result.getEndS(), result.getSampleCount());
            return result;
        }
    }

    public ResampledSignal resample(double[] samples, double origFs, double targetFs) {
        if (samples == null) {
            throw new IllegalArgumentException("samples are required");
        }
        return PolyphaseResampler.resample(samples, origFs, targetFs);
    }

    @Scheduled(fixedDelayString = "${signal-sync.session-sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        int removed = repository.removeIdleSince(Instant.now().minus(idleTimeout));
        if (removed > 0) {
            log.info("Evicted {} idle session(s), {} open", removed, repository.count());
        }
    }

    private AnalysisSession find(String id) {
        AnalysisSession session = repository.findById(id).orElseThrow(() -> new SessionNotFoundException(id));
        session.setLastAccessedAt(Instant.now());
        return session;
    }

    private static SessionView view(AnalysisSession session) {
        synchronized (session) {
            return SessionView.of(session);
        }
    }

    private static void requireSignals(AnalysisRequest request) {
        if (request == null || request.getT() == null || request.getPpg() == null || request.getEcg() == null) {
            throw new IllegalArgumentException("t, ppg and ecg arrays are required");
        }
    }
}
