package com.delta.siteaudit.generation.schema;

public enum FieldType {
    STRING,
    INTEGER,
    ENUM,
    OBJECT,
    ARRAY
}
