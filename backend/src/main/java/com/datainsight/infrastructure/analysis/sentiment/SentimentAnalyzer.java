package com.datainsight.infrastructure.analysis.sentiment;

import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.FeatureSet;
import com.datainsight.domain.analysis.model.SentimentConfig;
import com.datainsight.domain.analysis.model.SentimentLabel;
import com.datainsight.domain.analysis.model.SentimentLexicon;
import com.datainsight.domain.analysis.model.SentimentResult;
import com.datainsight.infrastructure.analysis.Analyzer;
import com.datainsight.infrastructure.analysis.preprocessing.TextTokenizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Lexicon-based polarity scoring. No model, no I/O.
 * <p>
 * score = (positiveHits - negativeHits) / max(1, wordCount); the label comes from
 * {@link SentimentConfig#labelFor(double)}. Token order does not matter.
 */
@Component
@RequiredArgsConstructor
public class SentimentAnalyzer implements Analyzer {

    private static final double BASE_CONFIDENCE = 0.5;
    private static final double CONFIDENCE_PER_HIT = 0.1;
    private static final double MAX_CONFIDENCE = 0.9;

    private final TextTokenizer tokenizer;
    private final SentimentConfig config;

    @Override
    public AnalysisType type() {
        return AnalysisType.SENTIMENT;
    }

    @Override
    public String description() {
        return "Lexicon-based sentiment classification with score and confidence";
    }

    @Override
    public SentimentResult analyze(AnalysisRequest request) {
        return analyze(tokenizer.extract(request.content()));
    }

    public SentimentResult analyze(FeatureSet features) {
        return analyze(features, config);
    }

    public static SentimentResult analyze(FeatureSet features, SentimentConfig config) {
        SentimentLexicon lexicon = config.lexicon();
        int positiveHits = 0;
        int negativeHits = 0;

        for (String token : features.normalizedTokens()) {
            if (lexicon.isPositive(token)) {
                positiveHits++;
            }
            if (lexicon.isNegative(token)) {
                negativeHits++;
            }
        }

        if (positiveHits == 0 && negativeHits == 0) {
            return new SentimentResult(SentimentLabel.NEUTRAL, 0.0, BASE_CONFIDENCE, 0, 0);
        }

        double score = (double) (positiveHits - negativeHits) / Math.max(1, features.wordCount());
        score = Math.max(-1.0, Math.min(1.0, score));
        SentimentLabel label = config.labelFor(score);

        return new SentimentResult(label, score, confidence(label, positiveHits, negativeHits),
                positiveHits, negativeHits);
    }

    private static double confidence(SentimentLabel label, int positiveHits, int negativeHits) {
        int hits = switch (label) {
            case POSITIVE -> positiveHits;
            case NEGATIVE -> negativeHits;
            case NEUTRAL -> 0;
        };
        return Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + hits * CONFIDENCE_PER_HIT);
    }
}
