package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One event as the agent sends it: {@code {type, data?, message?, final_response?}}.
 *
 * {@code data} stays an untyped tree because its fields depend on the type.
 */
public record RawAgentEvent(
        String   type,
        JsonNode data,
        String   message,
        @JsonProperty("final_response") String finalResponse
) {

    public static RawAgentEvent of(String type, JsonNode data) {
        return new RawAgentEvent(type, data, null, null);
    }

    /** Text value of a data field; non-textual values are rendered as JSON. Empty when absent, null or blank. */
    public Optional<String> dataText(String field) {
        if (data == null || !data.hasNonNull(field)) {
            return Optional.empty();
        }
        JsonNode node = data.get(field);
        String text = node.isValueNode() ? node.asText() : node.toString();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /** Event message, else {@code data.message}. */
    public Optional<String> messageText() {
        if (message != null && !message.isEmpty()) {
            return Optional.of(message);
        }
        return dataText("message");
    }

    @JsonIgnore
    public boolean isTerminal() {
        return "done".equals(type) || "error".equals(type);
    }
}
