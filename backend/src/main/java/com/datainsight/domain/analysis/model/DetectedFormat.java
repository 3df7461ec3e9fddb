package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectedFormat {
    CSV("csv"),
    JSON("json"),
    TEXT("text"),
    UNKNOWN("unknown");

    private final String id;

    DetectedFormat(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
