package com.datainsight.domain.analysis.exception;

import com.datainsight.domain.analysis.model.ErrorKind;

public class BatchTooLargeException extends AnalysisException {

    public BatchTooLargeException(int size, int maxSize) {
        super(ErrorKind.BATCH_TOO_LARGE,
                String.format("Batch of %d items exceeds the maximum of %d", size, maxSize));
    }
}
