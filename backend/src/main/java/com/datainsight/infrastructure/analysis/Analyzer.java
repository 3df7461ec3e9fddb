package com.datainsight.infrastructure.analysis;

import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisResult;
import com.datainsight.domain.analysis.model.AnalysisType;

/**
 * One analyzer kind. The dispatcher registers every implementation under
 * the type it declares.
 */
public interface Analyzer {

    AnalysisType type();

    /**
     * Short human-readable description for the capabilities listing.
     */
    String description();

    AnalysisResult analyze(AnalysisRequest request);
}
