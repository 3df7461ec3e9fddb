package com.datainsight.domain.analysis.model;

import java.util.List;

/**
 * Primitive counts and tokens derived from one piece of text.
 * Built fresh for every analysis call.
 *
 * @param wordCount        number of whitespace-separated tokens
 * @param sentenceCount    number of sentences split on . ! ?
 * @param charCount        length of the normalized text
 * @param uniqueWords      distinct lower-cased, punctuation-stripped words
 * @param avgWordLength    mean raw token length, 0 when there are no tokens
 * @param tokens           raw tokens in order
 * @param normalizedTokens lower-cased, punctuation-stripped tokens in order (empty ones dropped)
 */
public record FeatureSet(
        int wordCount,
        int sentenceCount,
        int charCount,
        int uniqueWords,
        double avgWordLength,
        List<String> tokens,
        List<String> normalizedTokens
) {
    public FeatureSet {
        tokens = List.copyOf(tokens);
        normalizedTokens = List.copyOf(normalizedTokens);
    }

    public static FeatureSet empty() {
        return new FeatureSet(0, 0, 0, 0, 0.0, List.of(), List.of());
    }
}
