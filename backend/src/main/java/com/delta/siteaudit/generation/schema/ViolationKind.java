package com.delta.siteaudit.generation.schema;

public enum ViolationKind {
    MALFORMED,
    TRUNCATED,
    MISSING,
    WRONG_TYPE,
    EMPTY,
    INVALID_ENUM,
    OUT_OF_RANGE,
    TOO_FEW_ITEMS,
    TOO_MANY_ITEMS
}
