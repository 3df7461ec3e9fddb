package com.datainsight.infrastructure.analysis;

import com.datainsight.domain.analysis.exception.AnalysisException;
import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisResult;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.ComprehensiveResult;
import com.datainsight.domain.analysis.model.DataFormatResult;
import com.datainsight.domain.analysis.model.DetectedFormat;
import com.datainsight.domain.analysis.model.ErrorKind;
import com.datainsight.domain.analysis.model.FeatureSet;
import com.datainsight.domain.analysis.model.FormatHint;
import com.datainsight.domain.analysis.model.SectionResult;
import com.datainsight.infrastructure.analysis.format.DataFormatAnalyzer;
import com.datainsight.infrastructure.analysis.preprocessing.TextTokenizer;
import com.datainsight.infrastructure.analysis.sentiment.SentimentAnalyzer;
import com.datainsight.infrastructure.analysis.stats.TextStatisticsAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs sentiment and text statistics on one shared feature set, plus the
 * data-format profile when the content is structured:
 * <p>
 * extract features → sentiment → text statistics → data format? → merge
 * </p>
 * A failing section is reported in place; the other sections still run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComprehensiveAnalyzer implements Analyzer {

    private final TextTokenizer tokenizer;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final TextStatisticsAnalyzer textStatisticsAnalyzer;
    private final DataFormatAnalyzer dataFormatAnalyzer;

    @Override
    public AnalysisType type() {
        return AnalysisType.COMPREHENSIVE;
    }

    @Override
    public String description() {
        return "Sentiment, text statistics and, for structured content, data-format profile";
    }

    @Override
    public ComprehensiveResult analyze(AnalysisRequest request) {
        FeatureSet features = tokenizer.extract(request.content());
        Map<String, SectionResult> sections = new LinkedHashMap<>();

        sections.put(ComprehensiveResult.SENTIMENT,
                runSection(ComprehensiveResult.SENTIMENT, () -> sentimentAnalyzer.analyze(features)));
        sections.put(ComprehensiveResult.TEXT_STATISTICS,
                runSection(ComprehensiveResult.TEXT_STATISTICS, () -> textStatisticsAnalyzer.analyze(features)));

        FormatHint hint = request.formatHint();
        if (hint != FormatHint.TEXT) {
            SectionResult dataFormat = runSection(ComprehensiveResult.DATA_FORMAT,
                    () -> dataFormatAnalyzer.analyze(request.content(), hint));
            if (hint.isStructured() || isStructuredContent(dataFormat)) {
                sections.put(ComprehensiveResult.DATA_FORMAT, dataFormat);
            }
        }

        return new ComprehensiveResult(sections);
    }

    private boolean isStructuredContent(SectionResult section) {
        if (!section.success()) {
            return true;
        }
        return section.result() instanceof DataFormatResult result
                && result.detectedFormat() != DetectedFormat.TEXT;
    }

    private SectionResult runSection(String name, Supplier<? extends AnalysisResult> section) {
        try {
            return SectionResult.ok(section.get());
        } catch (AnalysisException e) {
            log.warn("Comprehensive section '{}' degraded: {}", name, e.getMessage());
            return SectionResult.failed(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Comprehensive section '{}' failed unexpectedly", name, e);
            return SectionResult.failed(ErrorKind.INTERNAL, "Internal error in " + name + " analysis");
        }
    }
}
