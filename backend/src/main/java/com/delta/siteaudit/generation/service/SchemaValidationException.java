package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.generation.schema.SchemaViolation;

import java.util.List;

/**
 * Generated output was still invalid after the last permitted attempt. The message names the
 * failing fields and is for logs only.
 */
public class SchemaValidationException extends RuntimeException {
    private final List<SchemaViolation> violations;
    private final int attempts;

    public SchemaValidationException(List<SchemaViolation> violations, int attempts) {
        super("Generated output invalid after " + attempts + " attempt(s); failing fields: " + fieldList(violations));
        this.violations = List.copyOf(violations);
        this.attempts = attempts;
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }

    public List<String> failingFields() {
        return violations.stream().map(SchemaViolation::path).distinct().toList();
    }

    public int getAttempts() {
        return attempts;
    }

    private static String fieldList(List<SchemaViolation> violations) {
        return String.join(", ", violations.stream().map(SchemaViolation::path).distinct().limit(25).toList());
    }
}
