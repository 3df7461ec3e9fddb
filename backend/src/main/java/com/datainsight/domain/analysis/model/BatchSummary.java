package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Aggregate statistics of a batch. Fields that do not apply to the
 * analysis type are null and omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchSummary(
        Double successRate,
        Double averageTextLength,
        Map<String, Integer> sentimentDistribution,
        Double averageConfidence,
        Double averageWordCount,
        Integer totalWords,
        String message
) {
    public static BatchSummary noSuccess() {
        return new BatchSummary(null, null, null, null, null, null, "No successful analyses");
    }
}
