package com.datainsight.domain.analysis.model;

import java.util.List;

/**
 * Per-item responses in input order; always as long as the input.
 */
public record BatchResult(List<AnalysisResponse> responses) {

    public BatchResult {
        responses = List.copyOf(responses);
    }

    public int size() {
        return responses.size();
    }

    public int successCount() {
        return (int) responses.stream().filter(AnalysisResponse::success).count();
    }
}
