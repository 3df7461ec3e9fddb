package com.datainsight.infrastructure.analysis.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty string are returned as-is")
    void null_and_empty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("Invisible characters are removed")
    void removes_invisible_chars() {
        assertThat(normalizer.normalize("hel\u200Blo\uFEFF")).isEqualTo("hello");
    }

    @Test
    @DisplayName("Control characters are removed")
    void removes_control_chars() {
        assertThat(normalizer.normalize("hel\u0001lo\u0007")).isEqualTo("hello");
    }

    @Test
    @DisplayName("\\r\\n and \\r become \\n")
    void normalizes_line_endings() {
        assertThat(normalizer.normalize("first\r\nsecond\rthird")).isEqualTo("first\nsecond\nthird");
    }

    @Test
    @DisplayName("Surrounding whitespace is trimmed")
    void trims() {
        assertThat(normalizer.normalize("  hello world \n")).isEqualTo("hello world");
    }

    @Test
    @DisplayName("Inner whitespace and tabs are kept")
    void keeps_inner_whitespace() {
        String input = "name\tage\nJohn\t30";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("Unicode NFC normalization")
    void nfc() {
        String decomposed = "cafe\u0301";
        assertThat(normalizer.normalize(decomposed)).isEqualTo("caf\u00E9");
    }

    @Test
    @DisplayName("Whitespace-only input becomes empty")
    void blank_becomes_empty() {
        assertThat(normalizer.normalize(" \t\n ")).isEmpty();
    }

    @Test
    @DisplayName("Soft hyphens and word joiners are removed")
    void removes_soft_hyphen_and_joiners() {
        assertThat(normalizer.normalize("co\u00ADop\u2060erate")).isEqualTo("cooperate");
    }

    @Test
    @DisplayName("Input of only non-rendering characters is empty")
    void effectively_empty() {
        assertThat(normalizer.isEffectivelyEmpty("\u200B\u200B")).isTrue();
        assertThat(normalizer.isEffectivelyEmpty("\u0001\u0002")).isTrue();
        assertThat(normalizer.isEffectivelyEmpty(null)).isTrue();
        assertThat(normalizer.isEffectivelyEmpty("\u200Ba")).isFalse();
    }
}
