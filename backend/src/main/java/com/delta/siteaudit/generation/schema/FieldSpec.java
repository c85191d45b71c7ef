package com.delta.siteaudit.generation.schema;

import java.util.Arrays;
import java.util.List;

/**
 * One node of the artifact schema. Objects list their fields, arrays describe their items.
 * Bounds that do not apply to a type are null.
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean required,
    List<String> allowedValues,
    Integer min,
    Integer max,
    FieldSpec items,
    List<FieldSpec> fields
) {

    public static FieldSpec string(String name) {
        return new FieldSpec(name, FieldType.STRING, true, List.of(), null, null, null, List.of());
    }

    public static FieldSpec integer(String name, int min, int max) {
        return new FieldSpec(name, FieldType.INTEGER, true, List.of(), min, max, null, List.of());
    }

    public static FieldSpec enumeration(String name, List<String> values) {
        return new FieldSpec(name, FieldType.ENUM, true, List.copyOf(values), null, null, null, List.of());
    }

    public static FieldSpec object(String name, FieldSpec... fields) {
        return new FieldSpec(name, FieldType.OBJECT, true, List.of(), null, null, null, Arrays.asList(fields));
    }

    public static FieldSpec array(String name, int minItems, int maxItems, FieldSpec items) {
        return new FieldSpec(name, FieldType.ARRAY, true, List.of(), minItems, maxItems, items, List.of());
    }

    public static FieldSpec stringArray(String name, int minItems, int maxItems) {
        return array(name, minItems, maxItems, string("item"));
    }

    public FieldSpec optional() {
        return new FieldSpec(name, type, false, allowedValues, min, max, items, fields);
    }

    public FieldSpec field(String fieldName) {
        for (FieldSpec field : fields) {
            if (field.name().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }
}
