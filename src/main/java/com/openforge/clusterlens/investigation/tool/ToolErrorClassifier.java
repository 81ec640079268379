package com.openforge.clusterlens.investigation.tool;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the message of a failed diagnostic call into a remediation summary.
 *
 * Every summary opens with a label that makes clear the failure belongs to
 * the tool call, so the model does not report it as a fault of the resource.
 */
public final class ToolErrorClassifier {

    public static final String TOOL_ERROR_LABEL = "TOOL ERROR (not a problem with the investigated resource)";

    private static final Pattern CONTAINER_CHOICES =
            Pattern.compile("(?:choose one of|valid containers?)\\s*:?\\s*\\[?([^\\]\\r\\n]+)\\]?",
                    Pattern.CASE_INSENSITIVE);

    // API server and provider wording for a container name that does not exist in the pod
    private static final Pattern WRONG_CONTAINER_WORDING = Pattern.compile(
            "container \\S+ is not valid for"
                    + "|container \"[^\"]*\" in pod \"[^\"]*\" is not valid"
                    + "|a container name must be specified");

    public enum Category {
        WRONG_CONTAINER,
        METRICS_UNAVAILABLE,
        FORBIDDEN,
        NOT_FOUND,
        GENERIC
    }

    private ToolErrorClassifier() {
    }

    public static Category categorize(String message) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);

        if (WRONG_CONTAINER_WORDING.matcher(text).find()) {
            return Category.WRONG_CONTAINER;
        }
        if (text.contains("metrics.k8s.io") || text.contains("metrics api")) {
            return Category.METRICS_UNAVAILABLE;
        }
        if (text.contains("forbidden") || text.contains("403")) {
            return Category.FORBIDDEN;
        }
        if (text.contains("not found") || text.contains("404")) {
            return Category.NOT_FOUND;
        }
        return Category.GENERIC;
    }

    public static String summarize(String toolName, String message) {
        String detail = message == null || message.isBlank() ? "no details" : firstLine(message);

        return switch (categorize(message)) {
            case WRONG_CONTAINER -> {
                String choices = containerChoices(message);
                yield "%s: WRONG CONTAINER NAME for %s (%s). %sRetry with a valid container name, or omit it to use the first container."
                        .formatted(TOOL_ERROR_LABEL, toolName, detail,
                                choices == null ? "" : "Valid containers: " + choices + ". ");
            }
            case METRICS_UNAVAILABLE ->
                    "%s: metrics are unavailable for %s (%s). metrics-server is probably not installed; use EVENTS or YAML for resource limits instead."
                            .formatted(TOOL_ERROR_LABEL, toolName, detail);
            case FORBIDDEN ->
                    "%s: access denied for %s (%s). The service account lacks RBAC permission for this read; use another tool."
                            .formatted(TOOL_ERROR_LABEL, toolName, detail);
            case NOT_FOUND ->
                    "%s: %s found nothing (%s). Check the kind and name, e.g. with TOOL: LIST_RESOURCES <kind>."
                            .formatted(TOOL_ERROR_LABEL, toolName, detail);
            case GENERIC ->
                    "%s: %s failed: %s".formatted(TOOL_ERROR_LABEL, toolName, detail);
        };
    }

    static String containerChoices(String message) {
        if (message == null) {
            return null;
        }
        Matcher m = CONTAINER_CHOICES.matcher(message);
        return m.find() ? m.group(1).trim() : null;
    }

    private static String firstLine(String message) {
        String trimmed = message.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).strip();
    }
}
