package com.datainsight.domain.analysis.model;

public record DataFormatResult(
        DetectedFormat detectedFormat,
        FormatStructure structure
) implements AnalysisResult {
}
