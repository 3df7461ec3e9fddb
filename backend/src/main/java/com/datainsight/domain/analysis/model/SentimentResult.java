package com.datainsight.domain.analysis.model;

/**
 * @param label         polarity derived from score by the configured thresholds
 * @param score         (positiveHits - negativeHits) / max(1, wordCount), in [-1, 1]
 * @param confidence    heuristic confidence in [0, 1]
 * @param positiveHits  tokens found in the positive lexicon
 * @param negativeHits  tokens found in the negative lexicon
 */
public record SentimentResult(
        SentimentLabel label,
        double score,
        double confidence,
        int positiveHits,
        int negativeHits
) implements AnalysisResult {
}
