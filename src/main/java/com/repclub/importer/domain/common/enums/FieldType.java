package com.repclub.importer.domain.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic types an import field can declare.
 * Each constant has a validator/transformer pair in FieldTypeRegistry.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    EMAIL("email"),
    PHONE("phone"),
    BOOLEAN("boolean"),
    CURRENCY("currency"),
    ENUM("enum");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
