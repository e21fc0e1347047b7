package ru.tigran.churnpredictor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.churnpredictor.dto.EnrichmentOutcome;
import ru.tigran.churnpredictor.dto.ZeroShotResult;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects which of a fixed set of candidate topics the feedback talks about,
 * using multi-label zero-shot classification.
 */
@Slf4j
@Service
public class TopicExtractor {

    private final InferenceGateway inferenceGateway;
    private final Set<String> candidateTopics;
    private final double threshold;

    public TopicExtractor(
            InferenceGateway inferenceGateway,
            @Value("${app.enrichment.candidate-topics}") List<String> candidateTopics,
            @Value("${app.enrichment.topic-threshold:0.8}") double threshold
    ) {
        this.inferenceGateway = inferenceGateway;
        this.candidateTopics = Collections.unmodifiableSet(new LinkedHashSet<>(candidateTopics));
        this.threshold = threshold;
    }

    public Set<String> getCandidateTopics() {
        return candidateTopics;
    }

    /**
     * Returns every candidate whose score is strictly above the threshold,
     * in the order the classifier ranked them.
     */
    public EnrichmentOutcome<Set<String>> extract(String feedbackText) {
        if (feedbackText == null || feedbackText.isBlank() || candidateTopics.isEmpty()) {
            return EnrichmentOutcome.success(Set.of());
        }

        ZeroShotResult result;
        try {
            result = inferenceGateway.classifyZeroShot(feedbackText, candidateTopics);
        } catch (RuntimeException e) {
            log.warn("Could not get topics from inference API: {}", e.getMessage());
            return EnrichmentOutcome.degraded(Set.of(), e.getMessage());
        }

        List<String> labels = result.labels();
        List<Double> scores = result.scores();
        if (labels == null || labels.isEmpty() || scores == null || scores.size() != labels.size()) {
            log.warn("Zero-shot response format unexpected or empty: {}", result);
            return EnrichmentOutcome.success(Set.of());
        }

        Set<String> topics = new LinkedHashSet<>();
        for (int i = 0; i < labels.size(); i++) {
            Double score = scores.get(i);
            if (score != null && score > threshold) {
                topics.add(labels.get(i));
            }
        }
        return EnrichmentOutcome.success(Collections.unmodifiableSet(topics));
    }
}
