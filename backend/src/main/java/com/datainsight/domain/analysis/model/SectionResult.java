package com.datainsight.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One sub-analysis inside a comprehensive report. Either {@code result}
 * or {@code errorKind}/{@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SectionResult(
        boolean success,
        AnalysisResult result,
        ErrorKind errorKind,
        String error
) {
    public static SectionResult ok(AnalysisResult result) {
        return new SectionResult(true, result, null, null);
    }

    public static SectionResult failed(ErrorKind kind, String error) {
        return new SectionResult(false, null, kind, error);
    }
}
