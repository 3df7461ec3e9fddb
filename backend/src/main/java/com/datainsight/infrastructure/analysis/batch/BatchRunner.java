package com.datainsight.infrastructure.analysis.batch;

import com.datainsight.domain.analysis.exception.AnalysisException;
import com.datainsight.domain.analysis.exception.BatchTooLargeException;
import com.datainsight.domain.analysis.exception.EmptyBatchException;
import com.datainsight.domain.analysis.model.AnalysisRequest;
import com.datainsight.domain.analysis.model.AnalysisResponse;
import com.datainsight.domain.analysis.model.AnalysisType;
import com.datainsight.domain.analysis.model.BatchResult;
import com.datainsight.domain.analysis.model.ErrorKind;
import com.datainsight.domain.analysis.model.FormatHint;
import com.datainsight.infrastructure.analysis.AnalysisDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Applies the dispatcher to every item of a batch on the analysis worker pool.
 * Output order matches input order; a failing item becomes a failed response
 * at its position instead of aborting the batch.
 */
@Slf4j
@Component
public class BatchRunner {

    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private final AnalysisDispatcher dispatcher;
    private final ExecutorService executor;

    @Value("${analysis.batch.max-size:100}")
    private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

    public BatchRunner(AnalysisDispatcher dispatcher,
                       @Qualifier("analysisExecutor") ExecutorService executor) {
        this.dispatcher = dispatcher;
        this.executor = executor;
    }

    public BatchResult run(List<String> items, AnalysisType analysisType) {
        return run(items, analysisType, FormatHint.AUTO);
    }

    /**
     * @throws EmptyBatchException    if items is null or empty
     * @throws BatchTooLargeException if items exceeds the configured maximum
     */
    public BatchResult run(List<String> items, AnalysisType analysisType, FormatHint formatHint) {
        if (items == null || items.isEmpty()) {
            throw new EmptyBatchException();
        }
        if (items.size() > maxBatchSize) {
            throw new BatchTooLargeException(items.size(), maxBatchSize);
        }

        List<CompletableFuture<AnalysisResponse>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            final int index = i;
            final String item = items.get(i);
            futures.add(CompletableFuture.supplyAsync(
                    () -> runItem(index, new AnalysisRequest(item, analysisType, formatHint)), executor));
        }

        BatchResult result = new BatchResult(futures.stream().map(CompletableFuture::join).toList());
        log.info("Batch finished: type={}, items={}, succeeded={}",
                analysisType == null ? null : analysisType.id(), result.size(), result.successCount());
        return result;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    private AnalysisResponse runItem(int index, AnalysisRequest request) {
        try {
            return dispatcher.dispatch(request);
        } catch (AnalysisException e) {
            log.warn("Batch item {} failed: [{}] {}", index, e.getKind(), e.getMessage());
            return AnalysisResponse.failure(request.analysisType(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Batch item {} failed unexpectedly", index, e);
            return AnalysisResponse.failure(request.analysisType(), ErrorKind.INTERNAL,
                    "Internal analysis error: " + e.getMessage());
        }
    }
}
