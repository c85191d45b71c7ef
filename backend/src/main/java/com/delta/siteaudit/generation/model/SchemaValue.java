package com.delta.siteaudit.generation.model;

import java.util.Arrays;
import java.util.List;

/**
 * Enumerations whose wire spelling differs from the constant name.
 */
public interface SchemaValue {
    String value();

    static <E extends Enum<E> & SchemaValue> List<String> valuesOf(Class<E> type) {
        return Arrays.stream(type.getEnumConstants()).map(SchemaValue::value).toList();
    }
}
