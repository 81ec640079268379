package com.openforge.clusterlens.investigation.diagnostic;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * The cluster resource an investigation is about.
 *
 * @param namespace empty for cluster-scoped kinds such as Node
 */
public record TargetResource(String kind, String namespace, String name) {

    public TargetResource {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        namespace = namespace == null ? "" : namespace;
    }

    @JsonIgnore
    public boolean isPod() {
        return "Pod".equalsIgnoreCase(kind);
    }

    @JsonIgnore
    public boolean isNamespaced() {
        return !namespace.isBlank();
    }

    /** "Pod/web-1 in namespace shop" form used in prompts and logs. */
    public String display() {
        return isNamespaced()
                ? "%s/%s in namespace %s".formatted(kind, name, namespace)
                : "%s/%s".formatted(kind, name);
    }
}
