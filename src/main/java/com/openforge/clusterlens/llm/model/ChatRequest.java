package com.openforge.clusterlens.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 * Tool calls travel as plain "TOOL:" lines inside the content, so no
 * function-calling fields are sent.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<ChatMessage> messages,
        Double temperature,
        Integer maxTokens,
        Boolean stream
) {

    public static ChatRequest of(String model, List<ChatMessage> messages,
                                 double temperature, int maxTokens) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .stream(false)
                .build();
    }
}
