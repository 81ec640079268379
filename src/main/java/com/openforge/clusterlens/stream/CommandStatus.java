package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CommandStatus {
    RUNNING,
    SUCCESS,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
