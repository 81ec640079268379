package com.openforge.clusterlens.investigation.tool;

/**
 * One TOOL: request as written by the model, not yet validated.
 *
 * @param name    the identifier after TOOL:, exactly as written
 * @param rawArgs the trimmed rest of the line, or null when nothing followed the name
 */
public record ToolInvocation(String name, String rawArgs) {

    public static ToolInvocation of(String name) {
        return new ToolInvocation(name, null);
    }

    public boolean hasArgs() {
        return rawArgs != null && !rawArgs.isBlank();
    }

    /** "LOGS my-app" form, used in log lines and progress messages. */
    public String display() {
        return hasArgs() ? name + " " + rawArgs : name;
    }
}
