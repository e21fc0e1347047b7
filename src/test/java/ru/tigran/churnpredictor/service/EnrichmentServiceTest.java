package ru.tigran.churnpredictor.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.churnpredictor.dto.Enrichment;
import ru.tigran.churnpredictor.dto.EnrichmentOutcome;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnrichmentService unit тесты")
class EnrichmentServiceTest {

    @Mock
    private SentimentAnalyzer sentimentAnalyzer;

    @Mock
    private TopicExtractor topicExtractor;

    private SimpleMeterRegistry meterRegistry;
    private EnrichmentService enrichmentService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        enrichmentService = new EnrichmentService(sentimentAnalyzer, topicExtractor, Runnable::run, meterRegistry);
    }

    @Test
    @DisplayName("enrich - объединяет тональность и темы")
    void combinesBothOperations() {
        when(sentimentAnalyzer.analyze("Slow support")).thenReturn(EnrichmentOutcome.success("NEGATIVE"));
        when(topicExtractor.extract("Slow support"))
                .thenReturn(EnrichmentOutcome.success(Set.of("customer support")));

        Enrichment enrichment = enrichmentService.enrich("Slow support");

        assertEquals("NEGATIVE", enrichment.sentimentLabel());
        assertEquals(Set.of("customer support"), enrichment.topicSet());
        assertFalse(enrichment.isDegraded());
        assertNull(meterRegistry.find("churn.enrichment.degraded").counter());
    }

    @Test
    @DisplayName("enrich - сбой одной операции не мешает другой")
    void oneFailureDoesNotAffectTheOther() {
        when(sentimentAnalyzer.analyze("Slow support"))
                .thenReturn(EnrichmentOutcome.degraded(SentimentAnalyzer.UNKNOWN, "503"));
        when(topicExtractor.extract("Slow support"))
                .thenReturn(EnrichmentOutcome.success(Set.of("speed")));

        Enrichment enrichment = enrichmentService.enrich("Slow support");

        assertEquals(SentimentAnalyzer.UNKNOWN, enrichment.sentimentLabel());
        assertEquals(Set.of("speed"), enrichment.topicSet());
        assertTrue(enrichment.isDegraded());
        assertEquals(1.0, meterRegistry.get("churn.enrichment.degraded").tag("operation", "sentiment").counter().count());
    }

    @Test
    @DisplayName("enrich - неожиданное исключение превращается в значения по умолчанию")
    void unexpectedExceptionDegrades() {
        when(sentimentAnalyzer.analyze("text")).thenThrow(new IllegalStateException("boom"));
        when(topicExtractor.extract("text")).thenThrow(new IllegalStateException("boom"));

        Enrichment enrichment = enrichmentService.enrich("text");

        assertEquals(SentimentAnalyzer.UNKNOWN, enrichment.sentimentLabel());
        assertTrue(enrichment.topicSet().isEmpty());
        assertEquals(1.0, meterRegistry.get("churn.enrichment.degraded").tag("operation", "topics").counter().count());
    }
}
