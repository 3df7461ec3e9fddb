package com.datainsight.domain.analysis.model;

/**
 * Format-specific structural profile inside a {@link DataFormatResult}.
 */
public interface FormatStructure {
}
