package com.openforge.clusterlens.investigation.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;

/**
 * Cleans and validates the raw argument text of a tool request.
 *
 * Wrapping characters the model likes to add ({@code [calico-node]},
 * {@code "api"}) are stripped first. What remains must fit the tool's
 * {@link ArgumentShape} and every token must match
 * {@link ToolGrammar#ARGUMENT_TOKEN}; anything else is a syntax error and the
 * tool is not run.
 */
@Slf4j
public final class ArgumentSanitizer {

    private ArgumentSanitizer() {
    }

    public static SanitizedArguments sanitize(ToolCatalog tool, String rawArgs) {
        ArgumentShape shape = tool.shape();
        String cleaned = strip(rawArgs);

        if (shape.maxTokens() == 0) {
            if (!cleaned.isEmpty()) {
                log.debug("[ArgumentSanitizer] Ignoring arguments '{}' for {}", rawArgs, tool.name());
            }
            return SanitizedArguments.none();
        }
        if (cleaned.isEmpty()) {
            return shape.minTokens() == 0
                    ? SanitizedArguments.none()
                    : SanitizedArguments.error(syntaxError(tool, rawArgs, "an argument is required"));
        }

        List<String> tokens = Arrays.asList(cleaned.split("\\s+"));
        if (tokens.size() < shape.minTokens() || tokens.size() > shape.maxTokens()) {
            String reason = shape.maxTokens() == 1
                    ? "expected a single name without spaces"
                    : "expected exactly %d arguments, got %d".formatted(shape.maxTokens(), tokens.size());
            return SanitizedArguments.error(syntaxError(tool, rawArgs, reason));
        }
        for (String token : tokens) {
            if (!ToolGrammar.isArgumentToken(token)) {
                return SanitizedArguments.error(syntaxError(tool, rawArgs,
                        "names may only contain letters, digits and . _ : / -"));
            }
        }
        return SanitizedArguments.of(tokens);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    static String strip(String rawArgs) {
        if (rawArgs == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(rawArgs.length());
        for (char c : rawArgs.toCharArray()) {
            if (ToolGrammar.STRIPPED_CHARS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString().trim();
    }

    private static String syntaxError(ToolCatalog tool, String rawArgs, String reason) {
        String usage = (ToolGrammar.TOKEN + " " + tool.name() + " " + tool.usage()).trim();
        return "TOOL SYNTAX ERROR (not a problem with the investigated resource): %s for %s (got \"%s\"). Usage: %s"
                .formatted(reason, tool.name(), rawArgs == null ? "" : rawArgs, usage);
    }
}
