package com.datainsight.infrastructure.analysis.stats;

import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.FeatureSet;
import com.datainsight.domain.analysis.model.TextStatsResult;
import com.datainsight.support.AnalysisFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextStatisticsAnalyzerTest {

    private TextStatisticsAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TextStatisticsAnalyzer(AnalysisFixtures.tokenizer());
    }

    private TextStatsResult analyze(String text) {
        return analyzer.analyze(new AnalysisRequest(text, AnalysisType.TEXT));
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Two-word sentence")
        void hello_world() {
            TextStatsResult result = analyze("Hello world");

            assertThat(result.wordCount()).isEqualTo(2);
            assertThat(result.sentenceCount()).isEqualTo(1);
            assertThat(result.characterCount()).isEqualTo(11);
            assertThat(result.uniqueWords()).isEqualTo(2);
            assertThat(result.avgSentenceLength()).isEqualTo(2.0);
            assertThat(result.avgWordLength()).isEqualTo(5.0);
            assertThat(result.uniqueWordRatio()).isEqualTo(1.0);
            assertThat(result.readabilityScore()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Repeated words lower the unique ratio")
        void repeated_words() {
            TextStatsResult result = analyze("the the the the");

            assertThat(result.uniqueWords()).isEqualTo(1);
            assertThat(result.uniqueWordRatio()).isEqualTo(0.25);
        }

        @Test
        @DisplayName("Average sentence length spreads words over sentences")
        void sentence_length() {
            TextStatsResult result = analyze("One two three. Four five six. Seven eight nine.");

            assertThat(result.sentenceCount()).isEqualTo(3);
            assertThat(result.avgSentenceLength()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Empty feature set yields zeros")
        void empty() {
            TextStatsResult result = analyzer.analyze(FeatureSet.empty());

            assertThat(result.wordCount()).isZero();
            assertThat(result.sentenceCount()).isZero();
            assertThat(result.avgSentenceLength()).isZero();
            assertThat(result.uniqueWordRatio()).isZero();
            assertThat(result.readabilityScore()).isZero();
        }
    }

    @Nested
    @DisplayName("Readability")
    class Readability {

        @Test
        @DisplayName("Formula value inside the range")
        void formula() {
            assertThat(TextStatisticsAnalyzer.readability(150, 5))
                    .isCloseTo(206.835 - 1.015 * 150 - 0.846 * 5, within(1e-9));
        }

        @Test
        @DisplayName("Clamped to [0, 100]")
        void clamped() {
            assertThat(TextStatisticsAnalyzer.readability(1, 1)).isEqualTo(100.0);
            assertThat(TextStatisticsAnalyzer.readability(250, 5)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Long run-on text stays within bounds")
        void long_text() {
            TextStatsResult result = analyze("extraordinarily ".repeat(300));

            assertThat(result.readabilityScore()).isBetween(0.0, 100.0);
            assertThat(result.uniqueWordRatio()).isBetween(0.0, 1.0);
        }
    }
}
