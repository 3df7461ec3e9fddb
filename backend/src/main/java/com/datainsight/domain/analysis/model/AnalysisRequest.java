package com.datainsight.domain.analysis.model;

/**
 * One unit of work for the dispatcher.
 *
 * @param content      decoded text content (validated by the dispatcher)
 * @param analysisType requested analysis
 * @param formatHint   parse mode, AUTO when not given
 */
public record AnalysisRequest(
        String content,
        AnalysisType analysisType,
        FormatHint formatHint
) {
    public AnalysisRequest {
        if (formatHint == null) {
            formatHint = FormatHint.AUTO;
        }
    }

    public AnalysisRequest(String content, AnalysisType analysisType) {
        this(content, analysisType, FormatHint.AUTO);
    }
}
