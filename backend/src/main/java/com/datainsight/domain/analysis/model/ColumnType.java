package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inferred CSV column type. Precedence: INTEGER > FLOAT > STRING.
 */
public enum ColumnType {
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string");

    private final String id;

    ColumnType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
