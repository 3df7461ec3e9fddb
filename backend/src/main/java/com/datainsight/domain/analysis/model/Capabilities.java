package com.datainsight.domain.analysis.model;

import java.util.Map;
import java.util.Set;

public record Capabilities(
        Set<AnalysisType> supportedAnalysisTypes,
        Set<FormatHint> supportedFormats,
        Map<String, String> analyzers,
        int maxBatchSize,
        double positiveThreshold,
        double negativeThreshold
) {
}
