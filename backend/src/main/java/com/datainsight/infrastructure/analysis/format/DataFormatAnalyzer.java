package com.datainsight.infrastructure.analysis.format;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.CsvStructure;
import com.datainsight.domain.analysis.model.DataFormatResult;
import com.datainsight.domain.analysis.model.DetectedFormat;
import com.datainsight.domain.analysis.model.FeatureSet;
import com.datainsight.domain.analysis.model.FormatHint;
import com.datainsight.domain.analysis.model.JsonStructure;
import com.datainsight.domain.analysis.model.TextStructure;
import com.datainsight.domain.analysis.model.UnknownStructure;
import com.datainsight.infrastructure.analysis.Analyzer;
import com.datainsight.infrastructure.analysis.preprocessing.TextTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Detects and profiles the format of raw content.
 * <p>
 * AUTO tries JSON, then CSV, then falls back to text (or unknown for
 * binary-looking content) and never fails. An explicit JSON or CSV hint
 * parses strictly and raises {@link com.datainsight.domain.analysis.exception.FormatParseException}
 * on malformed content.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataFormatAnalyzer implements Analyzer {

    // Share of control characters above which AUTO reports UNKNOWN
    private static final double BINARY_CONTROL_RATIO = 0.1;

    private static final char BOM = '\uFEFF';

    private final JsonProfiler jsonProfiler;
    private final CsvProfiler csvProfiler;
    private final TextTokenizer tokenizer;

    @Override
    public AnalysisType type() {
        return AnalysisType.DATA_FORMAT;
    }

    @Override
    public String description() {
        return "Format detection (JSON, CSV, text) with structural profile";
    }

    @Override
    public DataFormatResult analyze(AnalysisRequest request) {
        return analyze(request.content(), request.formatHint());
    }

    public DataFormatResult analyze(String content, FormatHint hint) {
        if (content == null) {
            throw new InvalidInputException("Content must be text");
        }
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }

        return switch (hint == null ? FormatHint.AUTO : hint) {
            case JSON -> new DataFormatResult(DetectedFormat.JSON, jsonProfiler.profile(content));
            case CSV -> new DataFormatResult(DetectedFormat.CSV, csvProfiler.profile(content));
            case TEXT -> new DataFormatResult(DetectedFormat.TEXT, profileText(content));
            case AUTO -> detect(content);
        };
    }

    private DataFormatResult detect(String content) {
        Optional<JsonStructure> json = jsonProfiler.tryProfile(content);
        if (json.isPresent()) {
            return new DataFormatResult(DetectedFormat.JSON, json.get());
        }

        Optional<CsvStructure> csv = csvProfiler.tryProfile(content);
        if (csv.isPresent()) {
            return new DataFormatResult(DetectedFormat.CSV, csv.get());
        }

        int controlChars = countControlChars(content);
        if (content.indexOf('\0') >= 0
                || (!content.isEmpty() && (double) controlChars / content.length() > BINARY_CONTROL_RATIO)) {
            log.debug("Content classified as unknown: {} control chars in {}", controlChars, content.length());
            return new DataFormatResult(DetectedFormat.UNKNOWN,
                    new UnknownStructure(content.length(), controlChars));
        }

        return new DataFormatResult(DetectedFormat.TEXT, profileText(content));
    }

    private TextStructure profileText(String content) {
        List<String> lines = content.lines().toList();
        int nonBlank = (int) lines.stream().filter(line -> !line.isBlank()).count();
        FeatureSet features = tokenizer.extract(content);
        return new TextStructure(lines.size(), nonBlank, features.wordCount(), content.length());
    }

    private int countControlChars(String content) {
        int count = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
                count++;
            }
        }
        return count;
    }
}
