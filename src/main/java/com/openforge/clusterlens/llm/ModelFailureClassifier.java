package com.openforge.clusterlens.llm;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;

/**
 * Maps a failed model call to one of a few user-facing explanations.
 *
 * Structured signals win: the HTTP status carried by {@link LlmClient.LlmException}
 * and the exception types in the cause chain. Message text is only consulted
 * when neither is present, e.g. for failures wrapped by a third-party layer.
 */
@Component
@RequiredArgsConstructor
public class ModelFailureClassifier {

    public enum Kind {
        MODEL_UNREACHABLE,
        MODEL_MISSING,
        AUTHENTICATION,
        RATE_LIMITED,
        PROVIDER_ERROR
    }

    /** Classified failure with the single message appended to the transcript. */
    public record ModelFailure(Kind kind, String message) {
    }

    private final LlmProperties properties;

    public ModelFailure classify(Throwable failure) {
        Kind kind = kindOf(failure);
        return new ModelFailure(kind, messageFor(kind, failure));
    }

    // ── Classification ───────────────────────────────────────────────────────

    static Kind kindOf(Throwable failure) {
        Integer status = null;
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof CallNotPermittedException
                    || t instanceof ConnectException
                    || t instanceof HttpTimeoutException
                    || t instanceof UnresolvedAddressException) {
                return Kind.MODEL_UNREACHABLE;
            }
            if (status == null && t instanceof LlmClient.LlmException le) {
                status = le.statusCode();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        if (status != null) {
            return switch (status) {
                case 429      -> Kind.RATE_LIMITED;
                case 401, 403 -> Kind.AUTHENTICATION;
                case 404      -> Kind.MODEL_MISSING;
                default       -> Kind.PROVIDER_ERROR;
            };
        }
        return kindFromText(allMessages(failure));
    }

    static Kind kindFromText(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("model") && (lower.contains("not found")
                || lower.contains("does not exist")
                || lower.contains("pull"))) {
            return Kind.MODEL_MISSING;
        }
        if (lower.contains("401") || lower.contains("403") || lower.contains("unauthorized")) {
            return Kind.AUTHENTICATION;
        }
        if (lower.contains("429") || lower.contains("rate limit") || lower.contains("rate-limit")) {
            return Kind.RATE_LIMITED;
        }
        if (lower.contains("connection refused")
                || lower.contains("econnrefused")
                || lower.contains("timed out")
                || lower.contains("timeout")
                || lower.contains("connection")) {
            return Kind.MODEL_UNREACHABLE;
        }
        return Kind.PROVIDER_ERROR;
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    private String messageFor(Kind kind, Throwable failure) {
        LlmProperties.ProviderConfig primary = properties.primary();
        return switch (kind) {
            case MODEL_UNREACHABLE -> "❌ **Connection Failed**: Cannot reach %s. Is the server running?"
                    .formatted(primary.baseUrl());
            case MODEL_MISSING -> ("❌ **Model Not Found**: %s answered but model \"%s\" is not available. "
                    + "Pull it (e.g. `ollama pull %s`) or check the base URL and model name in the configuration.")
                    .formatted(primary.baseUrl(), primary.model(), primary.model());
            case AUTHENTICATION -> "❌ **Authentication Failed**: Check the API key configured for provider %s."
                    .formatted(primary.name());
            case RATE_LIMITED -> "❌ **Rate Limited**: Provider %s is throttling requests. Wait a moment and ask again."
                    .formatted(primary.name());
            case PROVIDER_ERROR -> "❌ **Model Error**: " + firstLine(failure);
        };
    }

    private static String allMessages(Throwable failure) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            sb.append(t.getClass().getSimpleName()).append(": ").append(t.getMessage()).append('\n');
        }
        return sb.toString();
    }

    private static String firstLine(Throwable failure) {
        String message = failure == null || failure.getMessage() == null
                ? (failure == null ? "unknown error" : failure.getClass().getSimpleName())
                : failure.getMessage().strip();
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
