package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VisibilityLabel implements SchemaValue {
    POOR("Poor"),
    LIMITED("Limited"),
    STRONG("Strong");

    private final String value;

    VisibilityLabel(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
