package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PhaseKind {
    PLANNING,
    EXECUTING,
    ANALYZING,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
