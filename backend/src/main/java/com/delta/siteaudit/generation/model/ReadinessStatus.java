package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReadinessStatus implements SchemaValue {
    PRESENT("present"),
    WEAK("weak"),
    MISSING("missing");

    private final String value;

    ReadinessStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
