package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Reads the agent's progress feed: one long-lived GET, one JSON event per line.
 *
 * Accepted line forms:
 *   {"type":"planning",...}          plain NDJSON
 *   data: {"type":"planning",...}    SSE data line
 *   : keep-alive / event: / id:      SSE framing, skipped
 *   blank                            skipped
 *
 * A line that is not valid JSON is logged and skipped. The reader stops after a
 * done or error event, when the connection is closed, or when the transport
 * fails; there is no idle timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentStreamClient {

    private static final String SSE_DATA = "data:";

    private final HttpClient            httpClient;
    private final ObjectMapper          objectMapper;
    private final AgentStreamProperties properties;
    private final ExecutorService       investigationExecutor;

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Opens the feed for one query and reads it on the executor.
     * The listener is called on the reader thread.
     */
    public StreamConnection open(String queryId, AgentStreamListener listener) {
        StreamConnection connection = new StreamConnection(queryId);
        HttpRequest request = HttpRequest.newBuilder(streamUri(queryId))
                .header("Accept", "text/event-stream, application/x-ndjson")
                .GET()
                .build();
        log.info("[Stream:{}] Opening {}", queryId, request.uri());
        connection.attachReader(investigationExecutor.submit(() -> read(request, connection, listener)));
        return connection;
    }

    URI streamUri(String queryId) {
        return URI.create(properties.streamUrl() + "?query_id="
                + URLEncoder.encode(queryId, StandardCharsets.UTF_8));
    }

    // ── Reader ───────────────────────────────────────────────────────────────

    private void read(HttpRequest request, StreamConnection connection, AgentStreamListener listener) {
        String queryId = connection.queryId();
        try {
            HttpResponse<Stream<String>> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
            try (Stream<String> lines = response.body()) {
                if (response.statusCode() >= 400) {
                    throw new StreamConnectionException(queryId,
                            "Agent stream returned HTTP " + response.statusCode());
                }
                if (!connection.attachBody(lines)) {
                    return;
                }
                if (consume(lines.iterator(), connection, listener)) {
                    return;
                }
            }
            if (!connection.isClosed()) {
                fail(connection, listener,
                        new StreamConnectionException(queryId, "Agent stream ended without a final event"));
            }

        } catch (StreamConnectionException e) {
            fail(connection, listener, e);
        } catch (IOException | UncheckedIOException e) {
            fail(connection, listener, new StreamConnectionException(queryId,
                    "Agent stream transport failed: " + e.getMessage(), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Stream:{}] Reader interrupted", queryId);
        }
    }

    /** @return true when a terminal event was delivered or the connection was closed */
    private boolean consume(Iterator<String> lines, StreamConnection connection, AgentStreamListener listener) {
        while (!connection.isClosed() && lines.hasNext()) {
            Optional<RawAgentEvent> event = decode(connection.queryId(), lines.next());
            if (event.isEmpty()) {
                continue;
            }
            listener.onEvent(event.get());
            if (event.get().isTerminal()) {
                log.info("[Stream:{}] Finished with '{}' event", connection.queryId(), event.get().type());
                return true;
            }
        }
        return connection.isClosed();
    }

    /** Parses one feed line; empty for framing, blank and malformed lines. */
    Optional<RawAgentEvent> decode(String queryId, String line) {
        String payload = line.strip();
        if (payload.isEmpty() || payload.startsWith(":")) {
            return Optional.empty();
        }
        if (payload.startsWith(SSE_DATA)) {
            payload = payload.substring(SSE_DATA.length()).strip();
        } else if (!payload.startsWith("{")) {
            // event:, id:, retry: and anything else that is not a JSON object
            return Optional.empty();
        }
        try {
            RawAgentEvent event = objectMapper.readValue(payload, RawAgentEvent.class);
            if (event == null || event.type() == null) {
                log.warn("[Stream:{}] Skipping event without a type: {}", queryId, abbreviate(payload));
                return Optional.empty();
            }
            return Optional.of(event);
        } catch (JsonProcessingException e) {
            log.warn("[Stream:{}] Skipping malformed line ({}): {}",
                    queryId, e.getOriginalMessage(), abbreviate(payload));
            return Optional.empty();
        }
    }

    private void fail(StreamConnection connection, AgentStreamListener listener, StreamConnectionException failure) {
        if (connection.isClosed()) {
            log.debug("[Stream:{}] Ignoring failure after close: {}", connection.queryId(), failure.getMessage());
            return;
        }
        log.warn("[Stream:{}] {}", connection.queryId(), failure.getMessage());
        listener.onFailure(failure);
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "…" : text;
    }
}
