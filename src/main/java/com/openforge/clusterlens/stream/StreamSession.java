package com.openforge.clusterlens.stream;

import com.openforge.clusterlens.websocket.InvestigationEvent;
import com.openforge.clusterlens.websocket.PhaseEventPublisher;
import com.openforge.clusterlens.websocket.PhaseThrottlerFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * One subscribed push feed: a connection, its normalizer and its throttler.
 *
 * Intermediate phases are throttled onto /topic/stream/{queryId}. The terminal
 * phase (done, error or a broken feed) closes the throttler, is published
 * directly, and is followed by a FINAL_ANSWER or ERROR event when the agent
 * sent a final response or an error text. close() releases the connection and
 * the pending throttle timer together.
 */
@Slf4j
public class StreamSession implements AgentStreamListener, AutoCloseable {

    private final String                 queryId;
    private final PhaseEventPublisher    publisher;
    private final StreamEventNormalizer  normalizer;
    private final PhaseThrottler<Phase>  throttler;
    private final Consumer<StreamSession> onEnd;
    private final Instant                openedAt = Instant.now();

    private volatile StreamConnection connection;
    private volatile boolean          finished;

    public StreamSession(String queryId,
                         PhaseEventPublisher publisher,
                         PhaseThrottlerFactory throttlers,
                         Consumer<StreamSession> onEnd) {
        this.queryId    = queryId;
        this.publisher  = publisher;
        this.normalizer = new StreamEventNormalizer();
        this.throttler  = throttlers.create(phase -> publisher.publishStream(InvestigationEvent.phase(queryId, phase, 0)));
        this.onEnd      = onEnd;
    }

    /** Binds the opened connection; closes it at once if the session already ended. */
    void attach(StreamConnection connection) {
        this.connection = connection;
        if (finished) {
            connection.close();
        }
    }

    // ── AgentStreamListener ──────────────────────────────────────────────────

    @Override
    public void onEvent(RawAgentEvent event) {
        if (finished) {
            return;
        }
        normalizer.normalize(event).ifPresent(phase -> {
            if (phase.isTerminal()) {
                end(phase);
            } else {
                throttler.emit(phase);
            }
        });

        if ("done".equals(event.type()) && event.finalResponse() != null) {
            publisher.publishStream(InvestigationEvent.finalAnswer(queryId, event.finalResponse()));
        } else if ("error".equals(event.type())) {
            publisher.publishStream(InvestigationEvent.error(queryId,
                    event.messageText().orElse("Unknown error")));
        }
    }

    @Override
    public void onFailure(StreamConnectionException failure) {
        if (finished) {
            return;
        }
        end(normalizer.connectionLost());
        publisher.publishStream(InvestigationEvent.error(queryId, StreamEventNormalizer.CONNECTION_LOST));
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public void close() {
        finished = true;
        throttler.close();
        StreamConnection current = connection;
        if (current != null) {
            current.close();
        }
    }

    public String queryId() {
        return queryId;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public boolean isFinished() {
        return finished;
    }

    StreamEventNormalizer normalizer() {
        return normalizer;
    }

    private void end(Phase terminal) {
        finished = true;
        throttler.close();
        publisher.publishStream(InvestigationEvent.phase(queryId, terminal, 0));
        log.info("[Stream:{}] Ended with {} phase", queryId, terminal.kind());
        onEnd.accept(this);
    }
}
