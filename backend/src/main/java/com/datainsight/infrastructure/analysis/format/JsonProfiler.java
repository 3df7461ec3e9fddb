package com.datainsight.infrastructure.analysis.format;

import com.datainsight.domain.analysis.exception.FormatParseException;
import com.datainsight.domain.analysis.model.JsonStructure;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strict JSON parsing and top-level shape profiling.
 * Rejects trailing content, comments and duplicate keys.
 */
@Component
public class JsonProfiler {

    private final ObjectMapper strictMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .build();

    /**
     * Profile content that must be JSON.
     *
     * @throws FormatParseException if the content is blank or not valid JSON
     */
    public JsonStructure profile(String content) {
        return describe(parse(content));
    }

    /**
     * Profile content if it parses as JSON, empty otherwise.
     */
    public Optional<JsonStructure> tryProfile(String content) {
        try {
            return Optional.of(profile(content));
        } catch (FormatParseException e) {
            return Optional.empty();
        }
    }

    private JsonNode parse(String content) {
        if (content == null || content.isBlank()) {
            throw new FormatParseException("Content is empty, expected JSON");
        }
        try {
            JsonNode node = strictMapper.readTree(content);
            if (node == null || node.isMissingNode()) {
                throw new FormatParseException("Content is empty, expected JSON");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new FormatParseException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonStructure describe(JsonNode node) {
        if (node.isObject()) {
            List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            return JsonStructure.object(keys);
        }
        if (node.isArray()) {
            return JsonStructure.array(node.size());
        }
        return JsonStructure.scalar(scalarType(node));
    }

    private String scalarType(JsonNode node) {
        if (node.isNull()) {
            return "null";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        if (node.isNumber()) {
            return "number";
        }
        return "string";
    }
}
