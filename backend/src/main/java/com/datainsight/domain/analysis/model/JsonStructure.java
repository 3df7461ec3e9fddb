package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Shape of a parsed JSON document. Only the fields matching
 * {@code topLevelType} are populated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonStructure(
        JsonValueKind topLevelType,
        Integer keyCount,
        List<String> keys,
        Integer elementCount,
        String valueType
) implements FormatStructure {

    public static JsonStructure object(List<String> keys) {
        return new JsonStructure(JsonValueKind.OBJECT, keys.size(), List.copyOf(keys), null, null);
    }

    public static JsonStructure array(int elementCount) {
        return new JsonStructure(JsonValueKind.ARRAY, null, null, elementCount, null);
    }

    public static JsonStructure scalar(String valueType) {
        return new JsonStructure(JsonValueKind.SCALAR, null, null, null, valueType);
    }
}
