package com.datainsight.domain.analysis.exception;

import com.datainsight.domain.analysis.model.ErrorKind;

public class EmptyBatchException extends AnalysisException {

    public EmptyBatchException() {
        super(ErrorKind.EMPTY_BATCH, "Batch must contain at least one item");
    }
}
