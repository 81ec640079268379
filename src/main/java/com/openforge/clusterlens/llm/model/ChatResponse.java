package com.openforge.clusterlens.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Convenience: text of the first choice, or an empty string when the model said nothing. */
    public String firstContent() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        ChatMessage message = choices.get(0).message();
        return message == null || message.content() == null ? "" : message.content();
    }

    public record Choice(
            int index,
            ChatMessage message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
