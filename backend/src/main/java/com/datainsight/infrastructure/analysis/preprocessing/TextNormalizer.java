package com.datainsight.infrastructure.analysis.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Canonical form of analysis input, shared by the tokenizer and the
 * dispatcher's emptiness check.
 * <p>
 * Applies NFC, drops characters that render as nothing (zero-width marks,
 * byte order marks, soft hyphens, C0 controls other than tab and line breaks),
 * unifies line breaks to {@code \n} and strips the ends. Inner spaces and tabs
 * are kept so delimited data keeps its shape.
 */
@Component
public class TextNormalizer {

    private static final Pattern NON_RENDERING = Pattern.compile(
            "[\\u200B-\\u200D\\u2060\\u180E\\uFEFF\\u00AD\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");

    /**
     * @return normalized text; null and "" are returned as-is
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        String visible = NON_RENDERING.matcher(composed).replaceAll("");
        return LINE_BREAK.matcher(visible).replaceAll("\n").strip();
    }

    /**
     * True when nothing analyzable remains after normalization.
     */
    public boolean isEffectivelyEmpty(String text) {
        return text == null || normalize(text).isEmpty();
    }
}
