package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.generation.schema.SchemaViolation;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record ParsedOutput(JsonNode tree, List<SchemaViolation> violations) {

    public ParsedOutput {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return tree != null && violations.isEmpty();
    }
}
