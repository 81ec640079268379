package com.openforge.clusterlens.investigation.tool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ToolStatus {
    SUCCESS,
    /** The tool was recognised but its arguments or the diagnostic call failed. */
    ERROR,
    /** The tool name is not in the catalog; nothing was attempted. */
    INVALID;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
