package com.openforge.clusterlens.investigation.tool;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed allow-list of read-only diagnostic tools the model may request.
 *
 * Every tool runs against the resource under investigation; only LOGS,
 * LOGS_PREVIOUS, LIST_RESOURCES and DESCRIBE_ANY take arguments.
 * Lookup is by exact, case-sensitive name.
 */
public enum ToolCatalog {

    YAML(ArgumentShape.NONE, "",
            "Full manifest of the resource under investigation"),
    EVENTS(ArgumentShape.NONE, "",
            "Events whose involved object is the resource"),
    LOGS(ArgumentShape.OPTIONAL_TOKEN, "[container]",
            "Recent logs of the current container (first container when omitted)"),
    LOGS_PREVIOUS(ArgumentShape.OPTIONAL_TOKEN, "[container]",
            "Logs of the previous, terminated container instance (crash loops)"),
    RELATED_PODS(ArgumentShape.NONE, "",
            "Sibling pods sharing the resource's owner or app label"),
    PARENT_DETAILS(ArgumentShape.NONE, "",
            "Owner chain, e.g. ReplicaSet then Deployment, StatefulSet, Job"),
    NETWORK_CHECK(ArgumentShape.NONE, "",
            "Services selecting the resource and the readiness of their endpoints"),
    RESOURCE_USAGE(ArgumentShape.NONE, "",
            "CPU and memory usage from metrics-server"),
    LIST_RESOURCES(ArgumentShape.REQUIRED_TOKEN, "<kind>",
            "List resources of a kind in the resource's namespace"),
    DESCRIBE_ANY(ArgumentShape.TWO_TOKENS, "<kind> <name>",
            "Details of any resource in the resource's namespace"),
    NODE_INFO(ArgumentShape.NONE, "",
            "Conditions and capacity of the node hosting the pod"),
    STORAGE_CHECK(ArgumentShape.NONE, "",
            "PersistentVolumeClaims mounted by the pod and their binding status");

    private static final Map<String, ToolCatalog> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    static {
        for (ToolCatalog tool : values()) {
            if (!ToolGrammar.isIdentifier(tool.name())) {
                throw new IllegalStateException("Tool name does not match the TOOL: grammar: " + tool.name());
            }
        }
    }

    private final ArgumentShape shape;
    private final String        usage;
    private final String        description;

    ToolCatalog(ArgumentShape shape, String usage, String description) {
        this.shape       = shape;
        this.usage       = usage;
        this.description = description;
    }

    public ArgumentShape shape() {
        return shape;
    }

    public String usage() {
        return usage;
    }

    public String description() {
        return description;
    }

    /** Exact, case-sensitive lookup. */
    public static Optional<ToolCatalog> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isKnown(String name) {
        return lookup(name).isPresent();
    }

    /** One line per tool, in the form the model is asked to reproduce. */
    public static String describe() {
        int width = Arrays.stream(values())
                .mapToInt(t -> signature(t).length())
                .max()
                .orElse(0);
        return Arrays.stream(values())
                .map(t -> ("%-" + width + "s  → %s").formatted(signature(t), t.description()))
                .collect(Collectors.joining("\n"));
    }

    private static String signature(ToolCatalog tool) {
        String head = ToolGrammar.TOKEN + " " + tool.name();
        return tool.usage().isEmpty() ? head : head + " " + tool.usage();
    }
}
