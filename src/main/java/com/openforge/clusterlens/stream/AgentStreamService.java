package com.openforge.clusterlens.stream;

import com.openforge.clusterlens.websocket.PhaseEventPublisher;
import com.openforge.clusterlens.websocket.PhaseThrottlerFactory;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the open push-feed subscriptions, at most one per query id.
 *
 * Subscribing again to the same query closes the previous session first, so a
 * fresh subscription always starts with an empty command history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentStreamService {

    private final AgentStreamClient     client;
    private final PhaseEventPublisher   publisher;
    private final PhaseThrottlerFactory throttlers;

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();

    public StreamSession subscribe(String queryId) {
        StreamSession session = new StreamSession(queryId, publisher, throttlers,
                ended -> sessions.remove(ended.queryId(), ended));
        StreamSession previous = sessions.put(queryId, session);
        if (previous != null) {
            log.info("[Stream:{}] Replacing existing subscription", queryId);
            previous.close();
        }
        session.attach(client.open(queryId, session));
        return session;
    }

    /** @return false when no subscription was open for the query */
    public boolean unsubscribe(String queryId) {
        StreamSession session = sessions.remove(queryId);
        if (session == null) {
            return false;
        }
        session.close();
        log.info("[Stream:{}] Unsubscribed", queryId);
        return true;
    }

    public boolean isSubscribed(String queryId) {
        return sessions.containsKey(queryId);
    }

    @PreDestroy
    public void closeAll() {
        if (!sessions.isEmpty()) {
            log.info("[AgentStreamService] Closing {} open stream(s)", sessions.size());
        }
        sessions.values().forEach(StreamSession::close);
        sessions.clear();
    }
}
