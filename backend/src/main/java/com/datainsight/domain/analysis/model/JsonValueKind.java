package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JsonValueKind {
    OBJECT("object"),
    ARRAY("array"),
    SCALAR("scalar");

    private final String id;

    JsonValueKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
