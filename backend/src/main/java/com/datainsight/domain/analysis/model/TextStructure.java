package com.datainsight.domain.analysis.model;

public record TextStructure(
        int lineCount,
        int nonBlankLineCount,
        int wordCount,
        int charCount
) implements FormatStructure {
}
