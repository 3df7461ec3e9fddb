package com.datainsight.domain.analysis.service;

import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.BatchResult;
import com.datainsight.domain.analysis.model.BatchSummary;
import com.datainsight.domain.analysis.model.ComprehensiveResult;
import com.datainsight.domain.analysis.model.SentimentLabel;
import com.datainsight.domain.analysis.model.SentimentResult;
import com.datainsight.domain.analysis.model.TextStatsResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates a batch into success rate plus type-specific statistics:
 * label distribution and confidence for sentiment, word totals for
 * text and comprehensive analyses.
 */
@Service
public class BatchSummaryCalculator {

    public BatchSummary summarize(List<String> items, BatchResult result, AnalysisType analysisType) {
        List<AnalysisResponse> responses = result.responses();
        List<Integer> successIndexes = new ArrayList<>();
        for (int i = 0; i < responses.size(); i++) {
            if (responses.get(i).success()) {
                successIndexes.add(i);
            }
        }
        if (successIndexes.isEmpty()) {
            return BatchSummary.noSuccess();
        }

        double successRate = (double) successIndexes.size() / responses.size();
        double averageTextLength = successIndexes.stream()
                .mapToInt(i -> items.get(i) == null ? 0 : items.get(i).length())
                .average()
                .orElse(0.0);

        Map<String, Integer> distribution = null;
        Double averageConfidence = null;
        Double averageWordCount = null;
        Integer totalWords = null;

        if (analysisType == AnalysisType.SENTIMENT) {
            List<SentimentResult> sentiments = successIndexes.stream()
                    .map(i -> responses.get(i).result())
                    .filter(SentimentResult.class::isInstance)
                    .map(SentimentResult.class::cast)
                    .toList();
            if (!sentiments.isEmpty()) {
                distribution = new LinkedHashMap<>();
                for (SentimentLabel label : SentimentLabel.values()) {
                    distribution.put(label.id(), 0);
                }
                for (SentimentResult sentiment : sentiments) {
                    distribution.merge(sentiment.label().id(), 1, Integer::sum);
                }
                averageConfidence = sentiments.stream()
                        .mapToDouble(SentimentResult::confidence)
                        .average()
                        .orElse(0.0);
            }
        } else if (analysisType == AnalysisType.TEXT || analysisType == AnalysisType.COMPREHENSIVE) {
            List<Integer> wordCounts = successIndexes.stream()
                    .map(i -> wordCount(responses.get(i)))
                    .flatMap(Optional::stream)
                    .toList();
            if (!wordCounts.isEmpty()) {
                totalWords = wordCounts.stream().mapToInt(Integer::intValue).sum();
                averageWordCount = (double) totalWords / wordCounts.size();
            }
        }

        return new BatchSummary(successRate, averageTextLength, distribution, averageConfidence,
                averageWordCount, totalWords, null);
    }

    private Optional<Integer> wordCount(AnalysisResponse response) {
        if (response.result() instanceof TextStatsResult stats) {
            return Optional.of(stats.wordCount());
        }
        if (response.result() instanceof ComprehensiveResult comprehensive) {
            return comprehensive.sectionResult(ComprehensiveResult.TEXT_STATISTICS, TextStatsResult.class)
                    .map(TextStatsResult::wordCount);
        }
        return Optional.empty();
    }
}
