package com.openforge.clusterlens.investigation.tool;

import java.util.List;

/**
 * A model reply split into its free-text reasoning and its tool requests.
 *
 * @param reasoning   text before the first TOOL: line, trimmed; the whole reply when no tool was requested
 * @param invocations tool requests in textual order; empty when the reply is a final answer
 */
public record ParsedReply(String reasoning, List<ToolInvocation> invocations) {

    public ParsedReply {
        reasoning   = reasoning == null ? "" : reasoning;
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
    }

    public static ParsedReply empty() {
        return new ParsedReply("", List.of());
    }

    public boolean requestsTools() {
        return !invocations.isEmpty();
    }
}
