package com.openforge.clusterlens.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Handle on one open push feed. close() releases the response body and stops
 * the reader; it is idempotent and safe to call from any thread.
 */
@Slf4j
public class StreamConnection implements AutoCloseable {

    private final String queryId;

    private volatile boolean closed;
    private Stream<String>   lines;
    private Future<?>        reader;

    StreamConnection(String queryId) {
        this.queryId = queryId;
    }

    public String queryId() {
        return queryId;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        Stream<String> body;
        Future<?> task;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            body = lines;
            task = reader;
        }
        if (body != null) {
            body.close();
        }
        if (task != null) {
            task.cancel(true);
        }
        log.debug("[Stream:{}] Connection closed", queryId);
    }

    // ── Reader bookkeeping ───────────────────────────────────────────────────

    synchronized void attachReader(Future<?> task) {
        this.reader = task;
        if (closed) {
            task.cancel(true);
        }
    }

    /** @return false when the connection was closed before the body arrived */
    synchronized boolean attachBody(Stream<String> body) {
        if (closed) {
            return false;
        }
        this.lines = body;
        return true;
    }
}
