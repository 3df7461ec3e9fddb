package com.datainsight.domain.analysis.model;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Caller-supplied parse mode. AUTO runs detection, the others force a parser.
 */
public enum FormatHint {
    TEXT("text"),
    JSON("json"),
    CSV("csv"),
    AUTO("auto");

    private final String id;

    FormatHint(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isStructured() {
        return this == JSON || this == CSV;
    }

    /**
     * Null or blank resolves to AUTO.
     */
    public static FormatHint fromId(String id) {
        if (id == null || id.isBlank()) {
            return AUTO;
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(h -> h.id.equals(key))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException("Unsupported format hint: " + id));
    }
}
