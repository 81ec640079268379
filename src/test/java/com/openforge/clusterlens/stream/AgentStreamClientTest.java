package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentStreamClientTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    private HttpServer server;
    private AgentStreamClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new AgentStreamClient(HttpClient.newHttpClient(), mapper,
                new AgentStreamProperties(baseUrl, "/analyze"), executor);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    void shouldReadNdjsonAndSseFramedEventsUntilDone() throws Exception {
        serve(200, """
                : keep-alive
                event: progress
                data: {"type":"planning","message":"Building plan"}

                {broken json
                {"type":"executing","data":{"command":"kubectl get pods","command_id":"c1"}}
                {"type":"done","final_response":"The pod is OOMKilled."}
                {"type":"planning","message":"never read"}
                """);
        Recorder recorder = new Recorder(3);

        client.open("q-1", recorder);

        assertTrue(recorder.events.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("planning", "executing", "done"),
                recorder.received.stream().map(RawAgentEvent::type).toList());
        assertEquals("Building plan", recorder.received.get(0).message());
        assertEquals("kubectl get pods", recorder.received.get(1).dataText("command").orElseThrow());
        assertEquals("The pod is OOMKilled.", recorder.received.get(2).finalResponse());
        assertEquals("query_id=q-1", lastQuery.get());
        assertNull(recorder.failure.get());
    }

    @Test
    void shouldReportFeedEndingWithoutFinalEvent() throws Exception {
        serve(200, "{\"type\":\"analyzing\"}\n");
        Recorder recorder = new Recorder(1);

        client.open("q-2", recorder);

        assertTrue(recorder.failed.await(5, TimeUnit.SECONDS));
        assertEquals(1, recorder.received.size());
        assertEquals("q-2", recorder.failure.get().queryId());
    }

    @Test
    void shouldReportHttpErrorStatus() throws Exception {
        serve(503, "unavailable");
        Recorder recorder = new Recorder(0);

        client.open("q-3", recorder);

        assertTrue(recorder.failed.await(5, TimeUnit.SECONDS));
        assertTrue(recorder.failure.get().getMessage().contains("HTTP 503"));
        assertTrue(recorder.received.isEmpty());
    }

    @Test
    void shouldNotReportFailureAfterClose() throws Exception {
        CountDownLatch hold = new CountDownLatch(1);
        server.createContext("/analyze", exchange -> {
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write("{\"type\":\"planning\"}\n".getBytes(StandardCharsets.UTF_8));
                body.flush();
                hold.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Recorder recorder = new Recorder(1);

        StreamConnection connection = client.open("q-4", recorder);
        assertTrue(recorder.events.await(5, TimeUnit.SECONDS));
        connection.close();
        hold.countDown();

        assertTrue(connection.isClosed());
        assertFalse(recorder.failed.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldSkipFramingAndMalformedLines() {
        assertTrue(client.decode("q", "").isEmpty());
        assertTrue(client.decode("q", ": ping").isEmpty());
        assertTrue(client.decode("q", "id: 7").isEmpty());
        assertTrue(client.decode("q", "data: {not json").isEmpty());
        assertTrue(client.decode("q", "{\"message\":\"no type\"}").isEmpty());
        assertEquals("error", client.decode("q", "data:{\"type\":\"error\",\"message\":\"boom\"}").orElseThrow().type());
    }

    @Test
    void shouldEncodeQueryId() {
        assertTrue(client.streamUri("a b&c").toString().endsWith("/analyze?query_id=a+b%26c"));
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private void serve(int status, String body) {
        server.createContext("/analyze", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }

    private static final class Recorder implements AgentStreamListener {

        private final List<RawAgentEvent> received = new CopyOnWriteArrayList<>();
        private final CountDownLatch events;
        private final CountDownLatch failed = new CountDownLatch(1);
        private final AtomicReference<StreamConnectionException> failure = new AtomicReference<>();

        Recorder(int expectedEvents) {
            this.events = new CountDownLatch(expectedEvents);
        }

        @Override
        public void onEvent(RawAgentEvent event) {
            received.add(event);
            events.countDown();
        }

        @Override
        public void onFailure(StreamConnectionException e) {
            failure.set(e);
            failed.countDown();
        }
    }
}
