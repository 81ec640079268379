package com.openforge.clusterlens.investigation.tool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ToolErrorKind {
    /** Arguments rejected before any diagnostic call. */
    SYNTAX,
    /** The diagnostic call itself failed. */
    EXECUTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
