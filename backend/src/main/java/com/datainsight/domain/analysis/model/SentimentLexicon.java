package com.datainsight.domain.analysis.model;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed positive and negative word sets. Entries are stored lower-cased.
 */
public record SentimentLexicon(Set<String> positiveWords, Set<String> negativeWords) {

    public SentimentLexicon {
        positiveWords = normalize(positiveWords);
        negativeWords = normalize(negativeWords);
    }

    public boolean isPositive(String normalizedToken) {
        return positiveWords.contains(normalizedToken);
    }

    public boolean isNegative(String normalizedToken) {
        return negativeWords.contains(normalizedToken);
    }

    private static Set<String> normalize(Set<String> words) {
        return words.stream()
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
