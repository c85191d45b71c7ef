package com.delta.siteaudit.generation.schema;

/**
 * A single reason generated output was rejected. {@code path} uses dotted field names with
 * bracketed indexes, e.g. {@code ai_interpretation.missing_elements[2].severity}; {@code $}
 * is the document itself.
 */
public record SchemaViolation(String path, ViolationKind kind, String detail) {

    public String describe() {
        return path + ": " + detail;
    }
}
