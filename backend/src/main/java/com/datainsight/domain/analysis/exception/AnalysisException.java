package com.datainsight.domain.analysis.exception;

import com.datainsight.domain.analysis.model.ErrorKind;

/**
 * Base of every failure raised by the analysis engine.
 */
public abstract class AnalysisException extends RuntimeException {

    private final ErrorKind kind;

    protected AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
