package com.openforge.clusterlens.investigation.tool;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Extracts TOOL: requests from a free-text model reply.
 *
 * Pure function over the reply text: no validation, no lookups. A line that
 * does not match {@link ToolGrammar#TOOL_LINE} is ordinary prose.
 */
@Component
public class CommandParser {

    public ParsedReply parse(String response) {
        if (response == null || response.isBlank()) {
            return ParsedReply.empty();
        }

        List<ToolInvocation> invocations = new ArrayList<>();
        int firstMatch = -1;

        Matcher matcher = ToolGrammar.TOOL_LINE.matcher(response);
        while (matcher.find()) {
            if (firstMatch < 0) {
                firstMatch = matcher.start();
            }
            String args = matcher.group(2);
            args = args == null ? null : args.trim();
            invocations.add(new ToolInvocation(matcher.group(1), args == null || args.isEmpty() ? null : args));
        }

        if (invocations.isEmpty()) {
            return new ParsedReply(response.trim(), List.of());
        }
        return new ParsedReply(response.substring(0, firstMatch).trim(), invocations);
    }
}
