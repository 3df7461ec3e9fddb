package com.datainsight.infrastructure.analysis.format;

import com.datainsight.domain.analysis.model.ColumnType;

import java.util.regex.Pattern;

/**
 * Classifies a column from its values with precedence INTEGER > FLOAT > STRING.
 * Values are trimmed and empty ones are ignored; an all-empty column is STRING.
 */
final class ColumnTypeInferrer {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ColumnTypeInferrer() {
    }

    static ColumnType infer(Iterable<String> values) {
        boolean seen = false;
        boolean allIntegers = true;

        for (String raw : values) {
            String value = raw == null ? "" : raw.trim();
            if (value.isEmpty()) {
                continue;
            }
            seen = true;
            if (INTEGER.matcher(value).matches()) {
                continue;
            }
            allIntegers = false;
            if (!FLOAT.matcher(value).matches()) {
                return ColumnType.STRING;
            }
        }

        if (!seen) {
            return ColumnType.STRING;
        }
        return allIntegers ? ColumnType.INTEGER : ColumnType.FLOAT;
    }
}
