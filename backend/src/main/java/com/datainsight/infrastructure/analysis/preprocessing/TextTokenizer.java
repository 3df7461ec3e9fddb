package com.datainsight.infrastructure.analysis.preprocessing;

import com.datainsight.domain.analysis.exception.InvalidInputException;
import com.datainsight.domain.analysis.model.FeatureSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits text into words and sentences and derives the {@link FeatureSet}
 * shared by the sentiment and statistics analyzers.
 * <p>
 * Words are whitespace-separated tokens. Sentences are fragments between runs
 * of {@code . ! ?} that contain at least one non-whitespace character; text
 * with words but no such fragment counts as one sentence.
 */
@Component
@RequiredArgsConstructor
public class TextTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_TERMINATORS = Pattern.compile("[.!?]+");

    // Leading/trailing characters that are neither letters nor digits
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile(
            "^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$"
    );

    private final TextNormalizer textNormalizer;

    public FeatureSet extract(String text) {
        if (text == null) {
            throw new InvalidInputException("Content must be text");
        }

        String normalized = textNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return FeatureSet.empty();
        }

        List<String> tokens = tokenize(normalized);
        List<String> normalizedTokens = new ArrayList<>(tokens.size());
        Set<String> unique = new HashSet<>();
        long totalLength = 0;

        for (String token : tokens) {
            totalLength += token.length();
            String word = normalizeToken(token);
            if (!word.isEmpty()) {
                normalizedTokens.add(word);
                unique.add(word);
            }
        }

        int wordCount = tokens.size();
        double avgWordLength = wordCount == 0 ? 0.0 : (double) totalLength / wordCount;

        return new FeatureSet(
                wordCount,
                countSentences(normalized, wordCount),
                normalized.length(),
                unique.size(),
                avgWordLength,
                tokens,
                normalizedTokens
        );
    }

    /**
     * Lower-case a raw token and strip its surrounding punctuation.
     */
    public String normalizeToken(String token) {
        return EDGE_PUNCTUATION.matcher(token.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String part : WHITESPACE.split(text)) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    private int countSentences(String text, int wordCount) {
        int sentences = 0;
        for (String fragment : SENTENCE_TERMINATORS.split(text)) {
            if (!fragment.isBlank()) {
                sentences++;
            }
        }
        // "!!!" or "..." alone: words but no fragment
        if (sentences == 0 && wordCount > 0) {
            return 1;
        }
        return sentences;
    }
}
