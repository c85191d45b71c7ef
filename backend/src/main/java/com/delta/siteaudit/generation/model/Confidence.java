package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence implements SchemaValue {
    SHALLOW("shallow"),
    PARTIAL("partial"),
    STRONG("strong");

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
