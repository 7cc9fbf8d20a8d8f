package com.github.stormino.transcoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    STARTED("started"),
    IN_PROGRESS("in_progress"),
    DONE("done"),
    ERROR("error");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
