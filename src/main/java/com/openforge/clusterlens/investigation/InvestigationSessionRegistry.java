package com.openforge.clusterlens.investigation;

import com.openforge.clusterlens.investigation.diagnostic.TargetResource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory home of every open investigation session.
 * Closing a session cancels its running turn and forgets its transcript.
 */
@Slf4j
@Component
public class InvestigationSessionRegistry {

    private final Map<String, InvestigationSession> sessions = new ConcurrentHashMap<>();

    public InvestigationSession open(TargetResource target) {
        InvestigationSession session = new InvestigationSession(target);
        sessions.put(session.id(), session);
        log.info("[Investigation:{}] Opened for {}", session.id(), target.display());
        return session;
    }

    public Optional<InvestigationSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<InvestigationSession> close(String sessionId) {
        InvestigationSession session = sessions.remove(sessionId);
        if (session != null) {
            session.cancel();
            log.info("[Investigation:{}] Closed ({} message(s) discarded)", sessionId, session.transcript().size());
        }
        return Optional.ofNullable(session);
    }

    @PreDestroy
    public void closeAll() {
        sessions.keySet().forEach(this::close);
    }
}
