package ru.tigran.churnpredictor.dto;

import java.util.Set;

/**
 * Sentiment and topics derived from one piece of feedback text.
 */
public record Enrichment(
        EnrichmentOutcome<String> sentiment,
        EnrichmentOutcome<Set<String>> topics
) {
    public String sentimentLabel() {
        return sentiment.value();
    }

    public Set<String> topicSet() {
        return topics.value();
    }

    public boolean isDegraded() {
        return sentiment.degraded() || topics.degraded();
    }
}
