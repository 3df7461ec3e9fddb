package com.datainsight.domain.analysis.model;

import java.util.List;
import java.util.Map;

/**
 * @param columns     header names in order
 * @param rowCount    data rows, header excluded
 * @param columnTypes column name to inferred type, in column order
 * @param delimiter   detected field delimiter
 * @param sampleRows  up to the first three data rows
 */
public record CsvStructure(
        List<String> columns,
        int rowCount,
        Map<String, ColumnType> columnTypes,
        String delimiter,
        List<Map<String, String>> sampleRows
) implements FormatStructure {
}
