package com.delta.siteaudit.generation.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a JSON tree against a {@link FieldSpec} and collects every violation rather than
 * stopping at the first, so a repair request can name all of them at once.
 */
public final class SchemaValidator {
    private SchemaValidator() {
    }

    public static List<SchemaViolation> validate(JsonNode document, FieldSpec rootSpec) {
        List<SchemaViolation> violations = new ArrayList<>();
        if (document == null || !document.isObject()) {
            violations.add(new SchemaViolation("$", ViolationKind.WRONG_TYPE, "expected a JSON object"));
            return violations;
        }
        validateObjectFields(document, rootSpec, "", violations);
        return violations;
    }

    private static void validateNode(JsonNode node, FieldSpec spec, String path, List<SchemaViolation> out) {
        switch (spec.type()) {
            case STRING -> {
                if (!node.isTextual()) {
                    out.add(new SchemaViolation(path, ViolationKind.WRONG_TYPE, "expected a string"));
                } else if (node.asText().isBlank()) {
                    out.add(new SchemaViolation(path, ViolationKind.EMPTY, "must not be blank"));
                }
            }
            case INTEGER -> {
                if (!node.isIntegralNumber()) {
                    out.add(new SchemaViolation(path, ViolationKind.WRONG_TYPE, "expected an integer"));
                    return;
                }
                long value = node.asLong();
                if ((spec.min() != null && value < spec.min()) || (spec.max() != null && value > spec.max())) {
                    out.add(new SchemaViolation(path, ViolationKind.OUT_OF_RANGE,
                        "must be between " + spec.min() + " and " + spec.max() + ", was " + value));
                }
            }
            case ENUM -> {
                if (!node.isTextual() || !spec.allowedValues().contains(node.asText())) {
                    out.add(new SchemaViolation(path, ViolationKind.INVALID_ENUM,
                        "must be one of " + spec.allowedValues() + ", was " + node));
                }
            }
            case OBJECT -> {
                if (!node.isObject()) {
                    out.add(new SchemaViolation(path, ViolationKind.WRONG_TYPE, "expected an object"));
                    return;
                }
                validateObjectFields(node, spec, path, out);
            }
            case ARRAY -> {
                if (!node.isArray()) {
                    out.add(new SchemaViolation(path, ViolationKind.WRONG_TYPE, "expected an array"));
                    return;
                }
                int size = node.size();
                if (spec.min() != null && size < spec.min()) {
                    out.add(new SchemaViolation(path, ViolationKind.TOO_FEW_ITEMS,
                        "needs at least " + spec.min() + " items, had " + size));
                }
                if (spec.max() != null && size > spec.max()) {
                    out.add(new SchemaViolation(path, ViolationKind.TOO_MANY_ITEMS,
                        "allows at most " + spec.max() + " items, had " + size));
                }
                for (int i = 0; i < size; i++) {
                    validateNode(node.get(i), spec.items(), path + "[" + i + "]", out);
                }
            }
        }
    }

    private static void validateObjectFields(JsonNode node, FieldSpec spec, String path, List<SchemaViolation> out) {
        for (FieldSpec field : spec.fields()) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();
            JsonNode child = node.get(field.name());
            if (child == null || child.isNull() || child.isMissingNode()) {
                if (field.required()) {
                    out.add(new SchemaViolation(fieldPath, ViolationKind.MISSING, "required field is missing"));
                }
                continue;
            }
            validateNode(child, field, fieldPath, out);
        }
    }
}
