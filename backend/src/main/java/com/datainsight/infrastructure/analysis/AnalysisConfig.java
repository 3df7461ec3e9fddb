package com.datainsight.infrastructure.analysis;

import com.datainsight.domain.analysis.model.SentimentConfig;
import com.datainsight.domain.analysis.model.SentimentLexicon;
import com.datainsight.infrastructure.analysis.sentiment.LexiconLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalysisConfig {

    @Value("${analysis.sentiment.positive-lexicon:classpath:lexicon/positive-words.txt}")
    private Resource positiveLexicon;

    @Value("${analysis.sentiment.negative-lexicon:classpath:lexicon/negative-words.txt}")
    private Resource negativeLexicon;

    @Value("${analysis.sentiment.positive-threshold:0.05}")
    private double positiveThreshold;

    @Value("${analysis.sentiment.negative-threshold:-0.05}")
    private double negativeThreshold;

    @Value("${analysis.batch.parallelism:4}")
    private int batchParallelism;

    @Bean
    public SentimentConfig sentimentConfig() {
        SentimentLexicon lexicon = new SentimentLexicon(
                LexiconLoader.load(positiveLexicon),
                LexiconLoader.load(negativeLexicon));
        return new SentimentConfig(lexicon, positiveThreshold, negativeThreshold);
    }

    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ExecutorService analysisExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, batchParallelism), threadFactory);
    }
}
