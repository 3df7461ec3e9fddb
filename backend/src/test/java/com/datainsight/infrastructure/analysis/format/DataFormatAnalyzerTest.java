package com.datainsight.infrastructure.analysis.format;

import com.datainsight.domain.analysis.exception.FormatParseException;
import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.ColumnType;
import com.datainsight.domain.analysis.model.CsvStructure;
import com.datainsight.domain.analysis.model.DataFormatResult;
import com.datainsight.domain.analysis.model.DetectedFormat;
import com.datainsight.domain.analysis.model.FormatHint;
import com.datainsight.domain.analysis.model.JsonStructure;
import com.datainsight.domain.analysis.model.TextStructure;
import com.datainsight.domain.analysis.model.UnknownStructure;
import com.datainsight.support.AnalysisFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFormatAnalyzerTest {

    private static final String CSV = "name,age,city\nJohn,25,NYC\nJane,30,LA";
    private static final String JSON = "{\"name\": \"John\", \"age\": 30}";

    private DataFormatAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = AnalysisFixtures.dataFormatAnalyzer();
    }

    @Nested
    @DisplayName("Auto detection")
    class AutoDetection {

        @Test
        @DisplayName("JSON object")
        void json() {
            DataFormatResult result = analyzer.analyze(JSON, FormatHint.AUTO);

            assertThat(result.detectedFormat()).isEqualTo(DetectedFormat.JSON);
            assertThat(((JsonStructure) result.structure()).keyCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("CSV table")
        void csv() {
            DataFormatResult result = analyzer.analyze(CSV, FormatHint.AUTO);

            assertThat(result.detectedFormat()).isEqualTo(DetectedFormat.CSV);
            assertThat(((CsvStructure) result.structure()).rowCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Prose falls back to text")
        void text() {
            DataFormatResult result = analyzer.analyze("Hello there.\n\nSecond line here", FormatHint.AUTO);

            assertThat(result.detectedFormat()).isEqualTo(DetectedFormat.TEXT);
            TextStructure structure = (TextStructure) result.structure();
            assertThat(structure.lineCount()).isEqualTo(3);
            assertThat(structure.nonBlankLineCount()).isEqualTo(2);
            assertThat(structure.wordCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("Malformed JSON is not an error in auto mode")
        void malformed_json_is_text() {
            assertThat(analyzer.analyze("{\"a\": 1", FormatHint.AUTO).detectedFormat())
                    .isEqualTo(DetectedFormat.TEXT);
        }

        @Test
        @DisplayName("Single-column lines are text in auto mode")
        void single_column_is_text() {
            assertThat(analyzer.analyze("name\nJohn\nJane", FormatHint.AUTO).detectedFormat())
                    .isEqualTo(DetectedFormat.TEXT);
        }

        @Test
        @DisplayName("Binary-looking content is unknown")
        void binary_is_unknown() {
            DataFormatResult result = analyzer.analyze("abc\0def", FormatHint.AUTO);

            assertThat(result.detectedFormat()).isEqualTo(DetectedFormat.UNKNOWN);
            assertThat(((UnknownStructure) result.structure()).controlCharCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Request without a hint runs detection")
        void request_defaults_to_auto() {
            DataFormatResult result = analyzer.analyze(new AnalysisRequest(JSON, AnalysisType.DATA_FORMAT));

            assertThat(result.detectedFormat()).isEqualTo(DetectedFormat.JSON);
        }
    }

    @Nested
    @DisplayName("Explicit hints")
    class ExplicitHints {

        @Test
        @DisplayName("CSV hint profiles column types")
        void csv_hint() {
            CsvStructure structure = (CsvStructure) analyzer.analyze(CSV, FormatHint.CSV).structure();

            assertThat(structure.columns()).containsExactly("name", "age", "city");
            assertThat(structure.columnTypes()).containsEntry("age", ColumnType.INTEGER)
                    .containsEntry("city", ColumnType.STRING);
        }

        @Test
        @DisplayName("Malformed content under a JSON hint fails")
        void json_hint_malformed() {
            assertThatThrownBy(() -> analyzer.analyze("{\"a\": 1", FormatHint.JSON))
                    .isInstanceOf(FormatParseException.class);
        }

        @Test
        @DisplayName("Inconsistent rows under a CSV hint fail")
        void csv_hint_malformed() {
            assertThatThrownBy(() -> analyzer.analyze("a,b\n1,2,3", FormatHint.CSV))
                    .isInstanceOf(FormatParseException.class);
        }

        @Test
        @DisplayName("A leading byte order mark does not hide JSON")
        void leading_bom() {
            String content = "\uFEFF" + JSON;

            assertThat(analyzer.analyze(content, FormatHint.AUTO))
                    .isEqualTo(analyzer.analyze(JSON, FormatHint.AUTO));
            assertThat(((JsonStructure) analyzer.analyze(content, FormatHint.JSON).structure()).keys())
                    .containsExactly("name", "age");
            assertThat(analyzer.analyze("\uFEFF" + CSV, FormatHint.CSV).structure())
                    .isEqualTo(analyzer.analyze(CSV, FormatHint.CSV).structure());
        }

        @Test
        @DisplayName("Text hint skips structural parsing")
        void text_hint() {
            assertThat(analyzer.analyze(JSON, FormatHint.TEXT).detectedFormat())
                    .isEqualTo(DetectedFormat.TEXT);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @Test
        @DisplayName("Re-serialized JSON is detected as JSON again")
        void json_roundtrip() throws Exception {
            ObjectMapper mapper = new ObjectMapper();
            String reserialized = mapper.writeValueAsString(mapper.readTree(JSON));

            DataFormatResult result = analyzer.analyze(reserialized, FormatHint.AUTO);

            assertThat(result).isEqualTo(analyzer.analyze(JSON, FormatHint.AUTO));
        }

        @Test
        @DisplayName("Re-printed CSV is detected as CSV again")
        void csv_roundtrip() throws Exception {
            StringWriter out = new StringWriter();
            try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
                for (CSVRecord record : CSVFormat.DEFAULT.parse(new StringReader(CSV))) {
                    printer.printRecord(record.toList());
                }
            }

            DataFormatResult result = analyzer.analyze(out.toString(), FormatHint.AUTO);

            assertThat(result.detectedFormat()).isEqualTo(DetectedFormat.CSV);
            assertThat(result.structure()).isEqualTo(analyzer.analyze(CSV, FormatHint.AUTO).structure());
        }
    }
}
