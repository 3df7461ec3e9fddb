package com.datainsight.domain.analysis.model;

import com.datainsight.domain.analysis.exception.UnsupportedAnalysisTypeException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum AnalysisType {
    SENTIMENT("sentiment"),
    TEXT("text"),
    DATA_FORMAT("data_format"),
    COMPREHENSIVE("comprehensive");

    private final String id;

    AnalysisType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolve a wire identifier ("sentiment", "data_format", ...) to its type.
     *
     * @throws UnsupportedAnalysisTypeException if the identifier is blank or unknown
     */
    public static AnalysisType fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new UnsupportedAnalysisTypeException(String.valueOf(id));
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(key))
                .findFirst()
                .orElseThrow(() -> new UnsupportedAnalysisTypeException(id));
    }
}
