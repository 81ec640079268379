package com.openforge.clusterlens.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.clusterlens.investigation.Message;
import com.openforge.clusterlens.investigation.MessageRole;
import com.openforge.clusterlens.investigation.ModelInference;
import com.openforge.clusterlens.llm.model.ChatMessage;
import com.openforge.clusterlens.llm.model.ChatRequest;
import com.openforge.clusterlens.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Model-inference collaborator backed by one or two OpenAI-compatible providers.
 *
 * Call graph:
 *
 *   complete(prompt, systemPrompt, history)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryClient.chat(request)
 *                 ↓ (only when a fallback provider is configured)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackClient.chat(request)
 *
 * Without a fallback, the primary failure is rethrown unchanged so that its
 * HTTP status and transport cause survive for failure classification.
 */
@Slf4j
@Component
public class LlmRouter implements ModelInference {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;
    private final LlmProperties  properties;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.hasFallback() ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null,
                properties,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              LlmProperties properties,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.properties     = properties;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public String complete(String prompt, String systemPrompt, List<Message> conversationHistory) {
        return chat(buildMessages(prompt, systemPrompt, conversationHistory)).firstContent();
    }

    /**
     * Route a chat request through primary → fallback with full resilience.
     * The model and sampling settings come from each provider's own config.
     */
    public ChatResponse chat(List<ChatMessage> messages) {
        LlmProperties.ProviderConfig primaryConfig = properties.primary();
        try {
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(ChatRequest.of(primaryConfig.model(), messages,
                            primaryConfig.temperature(), primaryConfig.maxTokens())));
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider [{}/{}] failed ({}), engaging fallback [{}/{}]. Cause: {}",
                    primaryClient.providerName(), primaryClient.modelName(),
                    primaryException.getClass().getSimpleName(),
                    fallbackClient.providerName(), fallbackClient.modelName(),
                    primaryException.getMessage());

            LlmProperties.ProviderConfig fallbackConfig = properties.fallback();
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(ChatRequest.of(fallbackConfig.model(), messages,
                            fallbackConfig.temperature(), fallbackConfig.maxTokens())));
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic — no AOP proxies, no annotations.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        return decorated.get();
    }

    /**
     * system prompt, then the prior conversation (tool messages are filtered
     * upstream, skipped here as well), then the round's prompt.
     */
    static List<ChatMessage> buildMessages(String prompt, String systemPrompt, List<Message> history) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        if (history != null) {
            for (Message m : history) {
                if (m.role() == MessageRole.USER) {
                    messages.add(ChatMessage.user(m.content()));
                } else if (m.role() == MessageRole.ASSISTANT) {
                    messages.add(ChatMessage.assistant(m.content()));
                }
            }
        }
        messages.add(ChatMessage.user(prompt));
        return messages;
    }
}
