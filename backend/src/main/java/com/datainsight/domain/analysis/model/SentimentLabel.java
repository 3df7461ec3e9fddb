package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SentimentLabel {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral");

    private final String id;

    SentimentLabel(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
