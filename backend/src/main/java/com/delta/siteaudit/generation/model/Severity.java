package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity implements SchemaValue {
    CRITICAL("critical"),
    SUPPORTING("supporting");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
