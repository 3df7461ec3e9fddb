package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one dispatched analysis. Exactly one of {@code result} and
 * {@code error} is populated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        boolean success,
        AnalysisType analysisType,
        AnalysisResult result,
        ErrorKind errorKind,
        String error
) {
    public static AnalysisResponse success(AnalysisType type, AnalysisResult result) {
        return new AnalysisResponse(true, type, result, null, null);
    }

    public static AnalysisResponse failure(AnalysisType type, ErrorKind kind, String error) {
        return new AnalysisResponse(false, type, null, kind, error);
    }
}
