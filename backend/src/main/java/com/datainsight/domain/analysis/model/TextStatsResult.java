package com.datainsight.domain.analysis.model;

public record TextStatsResult(
        int wordCount,
        int sentenceCount,
        int characterCount,
        int uniqueWords,
        double avgSentenceLength,
        double avgWordLength,
        double uniqueWordRatio,
        double readabilityScore
) implements AnalysisResult {
}
