package com.datainsight.domain.analysis.exception;

import com.datainsight.domain.analysis.model.ErrorKind;

public class InvalidInputException extends AnalysisException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ErrorKind.INVALID_INPUT, message, cause);
    }
}
