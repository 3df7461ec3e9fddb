package com.datainsight.infrastructure.analysis.stats;

import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.FeatureSet;
import com.datainsight.domain.analysis.model.TextStatsResult;
import com.datainsight.infrastructure.analysis.Analyzer;
import com.datainsight.infrastructure.analysis.preprocessing.TextTokenizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Composition and readability metrics over a {@link FeatureSet}.
 * <p>
 * readability = clamp(0, 100, 206.835 - 1.015 * avgSentenceLength - 0.846 * avgWordLength),
 * with avgWordLength measured in characters. Empty text scores 0.
 */
@Component
@RequiredArgsConstructor
public class TextStatisticsAnalyzer implements Analyzer {

    static final double READABILITY_BASE = 206.835;
    static final double SENTENCE_LENGTH_WEIGHT = 1.015;
    static final double WORD_LENGTH_WEIGHT = 0.846;

    private final TextTokenizer tokenizer;

    @Override
    public AnalysisType type() {
        return AnalysisType.TEXT;
    }

    @Override
    public String description() {
        return "Text statistics: counts, averages, vocabulary richness and readability";
    }

    @Override
    public TextStatsResult analyze(AnalysisRequest request) {
        return analyze(tokenizer.extract(request.content()));
    }

    public TextStatsResult analyze(FeatureSet features) {
        int words = features.wordCount();
        double avgSentenceLength = (double) words / Math.max(1, features.sentenceCount());
        double uniqueWordRatio = (double) features.uniqueWords() / Math.max(1, words);

        return new TextStatsResult(
                words,
                features.sentenceCount(),
                features.charCount(),
                features.uniqueWords(),
                avgSentenceLength,
                features.avgWordLength(),
                uniqueWordRatio,
                words == 0 ? 0.0 : readability(avgSentenceLength, features.avgWordLength())
        );
    }

    public static double readability(double avgSentenceLength, double avgWordLength) {
        double score = READABILITY_BASE
                - SENTENCE_LENGTH_WEIGHT * avgSentenceLength
                - WORD_LENGTH_WEIGHT * avgWordLength;
        return Math.max(0.0, Math.min(100.0, score));
    }
}
