package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequirementStatus implements SchemaValue {
    NOT_FOUND("not_found"),
    WEAK("weak"),
    MISSING("missing");

    private final String value;

    RequirementStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
