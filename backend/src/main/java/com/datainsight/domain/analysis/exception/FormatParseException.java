package com.datainsight.domain.analysis.exception;

import com.datainsight.domain.analysis.model.ErrorKind;

public class FormatParseException extends AnalysisException {

    public FormatParseException(String message) {
        super(ErrorKind.FORMAT_PARSE, message);
    }

    public FormatParseException(String message, Throwable cause) {
        super(ErrorKind.FORMAT_PARSE, message, cause);
    }
}
