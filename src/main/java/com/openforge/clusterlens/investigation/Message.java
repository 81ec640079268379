package com.openforge.clusterlens.investigation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * One entry of an investigation transcript.
 *
 * toolName and command are only set on TOOL messages: the tool that ran and
 * the kubectl command it is equivalent to (absent when no call was made).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record Message(
        MessageRole role,
        String      content,
        String      toolName,
        String      command
) {

    public Message {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public static Message user(String content) {
        return new Message(MessageRole.USER, content, null, null);
    }

    public static Message assistant(String content) {
        return new Message(MessageRole.ASSISTANT, content, null, null);
    }

    public static Message tool(String toolName, String content, String command) {
        return new Message(MessageRole.TOOL, content, toolName, command);
    }

    @JsonIgnore
    public boolean isTool() {
        return role == MessageRole.TOOL;
    }
}
