package com.datainsight.domain.analysis.model;

public enum ErrorKind {
    INVALID_INPUT,
    FORMAT_PARSE,
    UNSUPPORTED_ANALYSIS_TYPE,
    BATCH_TOO_LARGE,
    EMPTY_BATCH,
    INTERNAL
}
