package com.datainsight.infrastructure.analysis.format;

import com.datainsight.domain.analysis.exception.FormatParseException;
import com.datainsight.domain.analysis.model.ColumnType;
import com.datainsight.domain.analysis.model.CsvStructure;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * CSV parsing and schema profiling on top of Apache Commons CSV.
 * <p>
 * The delimiter is the first of {@code , \t ; |} that occurs in the header line
 * and gives every record the header's field count. The first record is the
 * header and at least one data row must follow.
 */
@Component
public class CsvProfiler {

    static final List<Character> DELIMITERS = List.of(',', '\t', ';', '|');

    private static final int SAMPLE_ROWS = 3;
    private static final int MIN_AUTO_COLUMNS = 2;

    /**
     * Profile content that must be CSV. A single column is accepted.
     *
     * @throws FormatParseException when no delimiter gives a consistent table
     */
    public CsvStructure profile(String content) {
        if (content == null || content.isBlank()) {
            throw new FormatParseException("Content is empty, expected CSV");
        }

        String headerLine = firstNonBlankLine(content);
        FormatParseException lastFailure = null;
        for (char delimiter : DELIMITERS) {
            if (headerLine.indexOf(delimiter) < 0) {
                continue;
            }
            try {
                return parse(content, delimiter);
            } catch (FormatParseException e) {
                lastFailure = e;
            }
        }
        if (lastFailure != null) {
            throw lastFailure;
        }
        // No candidate delimiter in the header: single-column table
        return parse(content, ',');
    }

    /**
     * Detection variant: requires at least two columns and never throws.
     */
    public Optional<CsvStructure> tryProfile(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            CsvStructure structure = profile(content);
            return structure.columns().size() >= MIN_AUTO_COLUMNS
                    ? Optional.of(structure)
                    : Optional.empty();
        } catch (FormatParseException e) {
            return Optional.empty();
        }
    }

    private CsvStructure parse(String content, char delimiter) {
        List<CSVRecord> records = readRecords(content, delimiter);
        if (records.size() < 2) {
            throw new FormatParseException("CSV requires a header row and at least one data row");
        }

        List<String> columns = header(records.get(0));
        List<CSVRecord> rows = records.subList(1, records.size());

        for (CSVRecord row : rows) {
            if (row.size() != columns.size()) {
                throw new FormatParseException(String.format(
                        "Inconsistent CSV row at line %d: expected %d fields but found %d",
                        row.getRecordNumber(), columns.size(), row.size()));
            }
        }

        Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            final int index = i;
            columnTypes.put(columns.get(i), ColumnTypeInferrer.infer(
                    rows.stream().map(r -> r.get(index)).toList()));
        }

        List<Map<String, String>> samples = new ArrayList<>();
        for (CSVRecord row : rows.subList(0, Math.min(SAMPLE_ROWS, rows.size()))) {
            Map<String, String> sample = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                sample.put(columns.get(i), row.get(i));
            }
            samples.add(sample);
        }

        return new CsvStructure(List.copyOf(columns), rows.size(), columnTypes,
                String.valueOf(delimiter), samples);
    }

    private List<CSVRecord> readRecords(String content, char delimiter) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        try (CSVParser parser = format.parse(new StringReader(content))) {
            return parser.getRecords();
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new FormatParseException("Malformed CSV: " + e.getMessage(), e);
        }
    }

    private List<String> header(CSVRecord record) {
        List<String> columns = new ArrayList<>(record.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < record.size(); i++) {
            String name = record.get(i);
            if (name.isBlank()) {
                throw new FormatParseException("CSV header has a blank column name at position " + (i + 1));
            }
            if (!seen.add(name)) {
                throw new FormatParseException("CSV header has a duplicate column: " + name);
            }
            columns.add(name);
        }
        return columns;
    }

    private String firstNonBlankLine(String content) {
        return content.lines()
                .filter(line -> !line.isBlank())
                .findFirst()
                .orElse("");
    }
}
