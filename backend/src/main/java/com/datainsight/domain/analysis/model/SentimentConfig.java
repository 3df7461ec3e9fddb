package com.datainsight.domain.analysis.model;

/**
 * Immutable sentiment scoring configuration, loaded once at startup.
 *
 * @param lexicon           positive/negative word sets
 * @param positiveThreshold scores strictly above this are positive
 * @param negativeThreshold scores strictly below this are negative
 */
public record SentimentConfig(
        SentimentLexicon lexicon,
        double positiveThreshold,
        double negativeThreshold
) {
    public static final double DEFAULT_POSITIVE_THRESHOLD = 0.05;
    public static final double DEFAULT_NEGATIVE_THRESHOLD = -0.05;

    public SentimentConfig {
        if (lexicon == null) {
            throw new IllegalArgumentException("lexicon is required");
        }
        if (negativeThreshold > positiveThreshold) {
            throw new IllegalArgumentException(String.format(
                    "negative threshold %.3f must not exceed positive threshold %.3f",
                    negativeThreshold, positiveThreshold));
        }
    }

    public SentimentConfig(SentimentLexicon lexicon) {
        this(lexicon, DEFAULT_POSITIVE_THRESHOLD, DEFAULT_NEGATIVE_THRESHOLD);
    }

    public SentimentLabel labelFor(double score) {
        if (score > positiveThreshold) {
            return SentimentLabel.POSITIVE;
        }
        if (score < negativeThreshold) {
            return SentimentLabel.NEGATIVE;
        }
        return SentimentLabel.NEUTRAL;
    }
}
