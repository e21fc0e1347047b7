package ru.tigran.churnpredictor.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.tigran.churnpredictor.dto.Enrichment;
import ru.tigran.churnpredictor.dto.EnrichmentOutcome;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs sentiment analysis and topic extraction side by side and waits for both.
 *
 * The two calls share no state. Each one already bounds itself with the HTTP timeout and
 * converts its own failures into a degraded outcome, so the join below always completes.
 */
@Slf4j
@Service
public class EnrichmentService {

    private final SentimentAnalyzer sentimentAnalyzer;
    private final TopicExtractor topicExtractor;
    private final Executor enrichmentExecutor;
    private final MeterRegistry meterRegistry;

    public EnrichmentService(
            SentimentAnalyzer sentimentAnalyzer,
            TopicExtractor topicExtractor,
            @Qualifier("enrichmentExecutor") Executor enrichmentExecutor,
            MeterRegistry meterRegistry
    ) {
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.topicExtractor = topicExtractor;
        this.enrichmentExecutor = enrichmentExecutor;
        this.meterRegistry = meterRegistry;
    }

    public Enrichment enrich(String feedbackText) {
        CompletableFuture<EnrichmentOutcome<String>> sentiment = CompletableFuture
                .supplyAsync(() -> sentimentAnalyzer.analyze(feedbackText), enrichmentExecutor)
                .exceptionally(e -> EnrichmentOutcome.degraded(SentimentAnalyzer.UNKNOWN, e.getMessage()));
        CompletableFuture<EnrichmentOutcome<Set<String>>> topics = CompletableFuture
                .supplyAsync(() -> topicExtractor.extract(feedbackText), enrichmentExecutor)
                .exceptionally(e -> EnrichmentOutcome.<Set<String>>degraded(Set.of(), e.getMessage()));

        Enrichment enrichment = new Enrichment(sentiment.join(), topics.join());

        recordDegradation("sentiment", enrichment.sentiment());
        recordDegradation("topics", enrichment.topics());
        log.info("Enrichment done: sentiment={}, topics={}", enrichment.sentimentLabel(), enrichment.topicSet());
        return enrichment;
    }

    private void recordDegradation(String operation, EnrichmentOutcome<?> outcome) {
        if (outcome.degraded()) {
            log.warn("Enrichment operation '{}' degraded to default {}: {}",
                    operation, outcome.value(), outcome.cause());
            meterRegistry.counter("churn.enrichment.degraded", "operation", operation).increment();
        }
    }
}
