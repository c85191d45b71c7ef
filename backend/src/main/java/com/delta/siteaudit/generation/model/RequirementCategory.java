package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequirementCategory implements SchemaValue {
    DECISION_CLARITY("Decision Clarity"),
    COMPARABILITY("Comparability"),
    TRUST_AND_AUTHORITY("Trust & Authority"),
    ENTITY_UNDERSTANDING("Entity Understanding"),
    RISK_REDUCTION("Risk Reduction");

    private final String value;

    RequirementCategory(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }
}
