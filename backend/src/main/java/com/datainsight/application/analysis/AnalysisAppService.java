package com.datainsight.application.analysis;

import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.BatchResult;
import com.datainsight.domain.analysis.model.BatchSummary;
import com.datainsight.domain.analysis.model.Capabilities;
import com.datainsight.domain.analysis.model.FormatHint;
import com.datainsight.domain.analysis.model.SentimentConfig;
import com.datainsight.domain.analysis.service.BatchSummaryCalculator;
import com.datainsight.infrastructure.analysis.AnalysisDispatcher;
import com.datainsight.infrastructure.analysis.batch.BatchRunner;
import com.datainsight.infrastructure.analysis.preprocessing.ContentDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations exposed to the HTTP layer: single analysis, batch analysis
 * and the capabilities listing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisAppService {

    private final AnalysisDispatcher dispatcher;
    private final BatchRunner batchRunner;
    private final BatchSummaryCalculator summaryCalculator;
    private final ContentDecoder contentDecoder;
    private final SentimentConfig sentimentConfig;

    public AnalysisResponse analyzeOne(String content, AnalysisType analysisType, FormatHint formatHint) {
        log.info("Analyzing {} chars, type={}, format={}",
                content == null ? 0 : content.length(), analysisType == null ? null : analysisType.id(),
                formatHint == null ? FormatHint.AUTO.id() : formatHint.id());
        return dispatcher.dispatch(new AnalysisRequest(content, analysisType, formatHint));
    }

    /**
     * Decode uploaded bytes as UTF-8 and analyze them.
     */
    public AnalysisResponse analyzeBytes(byte[] content, AnalysisType analysisType, FormatHint formatHint) {
        return analyzeOne(contentDecoder.decode(content), analysisType, formatHint);
    }

    public BatchResult analyzeBatch(List<String> contents, AnalysisType analysisType) {
        log.info("Analyzing batch of {} items, type={}",
                contents == null ? 0 : contents.size(), analysisType == null ? null : analysisType.id());
        return batchRunner.run(contents, analysisType);
    }

    public BatchSummary summarize(List<String> contents, BatchResult result, AnalysisType analysisType) {
        return summaryCalculator.summarize(contents, result, analysisType);
    }

    public Capabilities describeCapabilities() {
        Map<String, String> analyzers = new LinkedHashMap<>();
        dispatcher.descriptions().forEach((type, description) -> analyzers.put(type.id(), description));

        Set<FormatHint> formats = EnumSet.of(FormatHint.TEXT, FormatHint.JSON, FormatHint.CSV);

        return new Capabilities(
                new LinkedHashSet<>(dispatcher.supportedTypes()),
                formats,
                analyzers,
                batchRunner.getMaxBatchSize(),
                sentimentConfig.positiveThreshold(),
                sentimentConfig.negativeThreshold());
    }
}
