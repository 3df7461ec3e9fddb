package com.datainsight.domain.analysis.model;

/**
 * Marker for every analyzer output carried inside an {@link AnalysisResponse}.
 */
public interface AnalysisResult {
}
