package com.openforge.clusterlens.investigation.tool;

/**
 * The result of one tool request.
 *
 * @param name              the requested tool name, as written by the model
 * @param status            success, error or invalid
 * @param errorKind         set only for {@link ToolStatus#ERROR}
 * @param summary           one-line description; for errors, the remediation shown to the model
 * @param output            diagnostic output, possibly truncated; empty for errors
 * @param command           kubectl equivalent of the call made; null when no call was made
 * @param truncated         whether output was cut to the configured limit
 */
public record ToolOutcome(
        String        name,
        ToolStatus    status,
        ToolErrorKind errorKind,
        String        summary,
        String        output,
        String        command,
        boolean       truncated
) {

    public ToolOutcome {
        summary = summary == null ? "" : summary;
        output  = output == null ? "" : output;
        if (status == ToolStatus.INVALID) {
            command = null;
        }
    }

    public static ToolOutcome success(String name, String summary, String output, String command, boolean truncated) {
        return new ToolOutcome(name, ToolStatus.SUCCESS, null, summary, output, command, truncated);
    }

    public static ToolOutcome syntaxError(String name, String summary) {
        return new ToolOutcome(name, ToolStatus.ERROR, ToolErrorKind.SYNTAX, summary, "", null, false);
    }

    public static ToolOutcome executionError(String name, String summary, String command) {
        return new ToolOutcome(name, ToolStatus.ERROR, ToolErrorKind.EXECUTION, summary, "", command, false);
    }

    public static ToolOutcome invalid(String name) {
        return new ToolOutcome(name, ToolStatus.INVALID, null,
                "⚠️ Invalid tool: %s. Valid tools: %s".formatted(name, validToolNames()),
                "", null, false);
    }

    public boolean isSuccess() {
        return status == ToolStatus.SUCCESS;
    }

    /** What goes into the transcript and the combined-results block. */
    public String content() {
        if (!isSuccess()) {
            return summary;
        }
        return output.isBlank() ? "(no output)" : output;
    }

    private static String validToolNames() {
        StringBuilder sb = new StringBuilder();
        for (ToolCatalog tool : ToolCatalog.values()) {
            if (!sb.isEmpty()) {
                sb.append(", ");
            }
            sb.append(tool.name());
        }
        return sb.toString();
    }
}
