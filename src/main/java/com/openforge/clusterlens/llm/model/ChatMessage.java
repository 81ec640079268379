package com.openforge.clusterlens.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single entry in the wire-level conversation sent to /chat/completions.
 *
 * role variants:
 *   "system"    — investigation instructions and tool catalog
 *   "user"      — human turn, or a tool-results continuation prompt
 *   "assistant" — earlier model replies
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String role,
        String content
) {

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage("assistant", content);
    }
}
