package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContentStatus implements SchemaValue {
    NOT_FOUND("not_found"),
    WEAK("weak"),
    PRESENT("present");

    private final String value;

    ContentStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
