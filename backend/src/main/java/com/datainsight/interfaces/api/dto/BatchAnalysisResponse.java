package com.datainsight.interfaces.api.dto;

import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.BatchSummary;

import java.util.List;

public record BatchAnalysisResponse(
        boolean success,
        int totalItems,
        int successfulItems,
        List<AnalysisResponse> results,
        BatchSummary summary
) {}
