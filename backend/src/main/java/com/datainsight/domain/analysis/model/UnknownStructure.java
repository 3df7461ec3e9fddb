package com.datainsight.domain.analysis.model;

/**
 * Profile for content that does not read as text (NUL bytes, mostly control characters).
 */
public record UnknownStructure(
        int charCount,
        int controlCharCount
) implements FormatStructure {
}
