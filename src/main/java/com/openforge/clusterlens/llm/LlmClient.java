package com.openforge.clusterlens.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.clusterlens.llm.model.ChatRequest;
import com.openforge.clusterlens.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Stateless HTTP client for one OpenAI-compatible provider.
 *
 * Only the blocking chat() call is needed: every investigation round waits
 * for the complete reply before the TOOL: lines can be parsed out of it.
 *
 * Failures are raised as {@link LlmException}.  The HTTP status (when the
 * provider answered at all) and the original transport exception are kept
 * on the exception so callers can classify the failure without parsing text.
 */
@Slf4j
public class LlmClient {

    private static final int ERROR_BODY_SNIPPET = 2048;

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking (non-streaming) chat completion.
     * The model field falls back to the provider's configured model when blank.
     */
    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }
        String model = request.model();
        if (model == null || model.isBlank()) {
            model = config.model();
        }
        ChatRequest effectiveRequest = ChatRequest.builder()
                .model(model)
                .messages(request.messages())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .stream(false)
                .build();

        String requestBody = serialize(effectiveRequest);
        log.debug("[LlmClient:{}] → chat POST model={} body-length={}",
                config.name(), model, requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody));
        return parseFullResponse(httpResponse);
    }

    /** The model name configured for this provider (e.g. "llama3.1"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(trimTrailingSlash(config.baseUrl()) + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder.build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s] at %s: %s"
                    .formatted(config.name(), config.baseUrl(), e.getMessage()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) {
            throw new LlmRateLimitException("Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new LlmException("Provider [%s] returned HTTP %d: %s"
                    .formatted(config.name(), status, snippet(body)), status);
        }

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), snippet(body)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() <= ERROR_BODY_SNIPPET ? body : body.substring(0, ERROR_BODY_SNIPPET);
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {

        /** HTTP status returned by the provider; null when no response was received. */
        private final Integer statusCode;

        public LlmException(String message) {
            super(message);
            this.statusCode = null;
        }

        public LlmException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = cause instanceof LlmException le ? le.statusCode() : null;
        }

        public LlmException(String message, int statusCode) {
            super(message);
            this.statusCode = statusCode;
        }

        public Integer statusCode() {
            return statusCode;
        }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message, 429); }
    }
}
