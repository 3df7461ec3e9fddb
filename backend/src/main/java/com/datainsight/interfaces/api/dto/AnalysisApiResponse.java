package com.datainsight.interfaces.api.dto;

import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.AnalysisResult;
import com.datainsight.domain.analysis.model.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisApiResponse(
        boolean success,
        String analysisType,
        AnalysisResult data,
        ErrorKind errorKind,
        String error,
        Map<String, Object> metadata
) {
    public static AnalysisApiResponse of(AnalysisResponse response, Map<String, Object> metadata) {
        return new AnalysisApiResponse(
                response.success(),
                response.analysisType() == null ? null : response.analysisType().id(),
                response.result(),
                response.errorKind(),
                response.error(),
                metadata);
    }
}
