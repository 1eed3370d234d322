package com.signalsync.cloud.repository;

import com.signalsync.cloud.model.AnalysisSession;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class AnalysisSessionRepository {

    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();

    public void save(AnalysisSession session) {
        sessions.put(session.getId(), session);
    }

    public Optional<AnalysisSession> findById(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public boolean delete(String id) {
        return sessions.remove(id) != null;
    }

    /**
     * Drops every session last accessed before {@code cutoff}.
     *
     * @return the number of sessions removed
     */
    public int removeIdleSince(Instant cutoff) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.getLastAccessedAt().isBefore(cutoff));
        return before - sessions.size();
    }

    public int count() {
        return sessions.size();
    }
}
