package com.datainsight.domain.analysis.exception;

import com.datainsight.domain.analysis.model.ErrorKind;

public class UnsupportedAnalysisTypeException extends AnalysisException {

    public UnsupportedAnalysisTypeException(String analysisType) {
        super(ErrorKind.UNSUPPORTED_ANALYSIS_TYPE, "Unsupported analysis type: " + analysisType);
    }
}
