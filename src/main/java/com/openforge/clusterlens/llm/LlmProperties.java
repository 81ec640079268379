package com.openforge.clusterlens.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised model provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     primary:
 *       name: ollama
 *       base-url: http://127.0.0.1:11434/v1
 *       api-key: ollama
 *       model: llama3.1
 *       timeout-seconds: 120
 *     fallback:            # optional
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o
 *
 * Every provider must expose an OpenAI-compatible /chat/completions endpoint.
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120")  int    timeoutSeconds,
            @DefaultValue("0.2")  double temperature,
            @DefaultValue("4096") int    maxTokens
    ) {}

    public boolean hasFallback() {
        return fallback != null && fallback.baseUrl() != null && !fallback.baseUrl().isBlank();
    }
}
