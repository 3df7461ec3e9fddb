package com.datainsight.infrastructure.analysis;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import com.datainsight.domain.analysis.exception.UnsupportedAnalysisTypeException;
import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.infrastructure.analysis.preprocessing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single entry point from analysis type to analyzer, shared by the
 * single-item and batch paths. Validates content before dispatching.
 */
@Slf4j
@Component
public class AnalysisDispatcher {

    public static final int DEFAULT_MAX_CONTENT_LENGTH = 100_000;

    private final Map<AnalysisType, Analyzer> analyzers = new EnumMap<>(AnalysisType.class);
    private final TextNormalizer textNormalizer;

    @Value("${analysis.max-content-length:100000}")
    private int maxContentLength = DEFAULT_MAX_CONTENT_LENGTH;

    public AnalysisDispatcher(List<Analyzer> analyzers, TextNormalizer textNormalizer) {
        this.textNormalizer = textNormalizer;
        for (Analyzer analyzer : analyzers) {
            Analyzer previous = this.analyzers.putIfAbsent(analyzer.type(), analyzer);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Analyzers %s and %s are both registered for %s",
                        previous.getClass().getSimpleName(), analyzer.getClass().getSimpleName(),
                        analyzer.type().id()));
            }
        }
        log.info("Registered analyzers: {}", this.analyzers.keySet().stream().map(AnalysisType::id).toList());
    }

    /**
     * Validate the request and run the analyzer registered for its type.
     *
     * @throws InvalidInputException            if content is missing, too long, or empty once normalized
     * @throws UnsupportedAnalysisTypeException if no analyzer handles the type
     */
    public AnalysisResponse dispatch(AnalysisRequest request) {
        if (request == null) {
            throw new InvalidInputException("Analysis request is required");
        }
        validateContent(request.content());

        AnalysisType type = request.analysisType();
        Analyzer analyzer = type == null ? null : analyzers.get(type);
        if (analyzer == null) {
            throw new UnsupportedAnalysisTypeException(type == null ? "null" : type.id());
        }

        return AnalysisResponse.success(type, analyzer.analyze(request));
    }

    public Set<AnalysisType> supportedTypes() {
        return Collections.unmodifiableSet(analyzers.keySet());
    }

    public Map<AnalysisType, String> descriptions() {
        Map<AnalysisType, String> descriptions = new LinkedHashMap<>();
        analyzers.forEach((type, analyzer) -> descriptions.put(type, analyzer.description()));
        return descriptions;
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    private void validateContent(String content) {
        if (content == null) {
            throw new InvalidInputException("Content must be provided as text");
        }
        if (content.length() > maxContentLength) {
            throw new InvalidInputException(String.format(
                    "Content length %d exceeds the maximum of %d characters",
                    content.length(), maxContentLength));
        }
        // Invisible and control characters alone count as empty
        if (textNormalizer.isEffectivelyEmpty(content)) {
            throw new InvalidInputException("Content must not be empty");
        }
    }
}
