package com.datainsight.domain.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Merged report keyed by section name ({@link #SENTIMENT}, {@link #TEXT_STATISTICS},
 * {@link #DATA_FORMAT}).
 */
public record ComprehensiveResult(Map<String, SectionResult> sections) implements AnalysisResult {

    public static final String SENTIMENT = "sentiment";
    public static final String TEXT_STATISTICS = "text_statistics";
    public static final String DATA_FORMAT = "data_format";

    public ComprehensiveResult {
        sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    public Optional<SectionResult> section(String name) {
        return Optional.ofNullable(sections.get(name));
    }

    /**
     * Successful result of a section, if it ran and produced the expected type.
     */
    public <T extends AnalysisResult> Optional<T> sectionResult(String name, Class<T> type) {
        return section(name)
                .filter(SectionResult::success)
                .map(SectionResult::result)
                .filter(type::isInstance)
                .map(type::cast);
    }
}
