package ru.tigran.churnpredictor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.churnpredictor.dto.EnrichmentOutcome;
import ru.tigran.churnpredictor.dto.LabelScore;

import java.util.List;

/**
 * Derives a single sentiment label from feedback text.
 *
 * Blank text is {@value #NEUTRAL} without a remote call. Any failure of the remote call
 * degrades to {@value #UNKNOWN}.
 */
@Slf4j
@Service
public class SentimentAnalyzer {

    public static final String POSITIVE = "POSITIVE";
    public static final String NEGATIVE = "NEGATIVE";
    public static final String NEUTRAL = "NEUTRAL";
    public static final String UNKNOWN = "UNKNOWN";

    private final InferenceGateway inferenceGateway;

    public SentimentAnalyzer(InferenceGateway inferenceGateway) {
        this.inferenceGateway = inferenceGateway;
    }

    public EnrichmentOutcome<String> analyze(String feedbackText) {
        if (feedbackText == null || feedbackText.isBlank()) {
            return EnrichmentOutcome.success(NEUTRAL);
        }

        List<LabelScore> scores;
        try {
            scores = inferenceGateway.classifySentiment(feedbackText);
        } catch (RuntimeException e) {
            log.warn("Could not get sentiment from inference API: {}", e.getMessage());
            return EnrichmentOutcome.degraded(UNKNOWN, e.getMessage());
        }

        if (scores.isEmpty()) {
            log.warn("Sentiment response was empty");
            return EnrichmentOutcome.degraded(UNKNOWN, "empty sentiment result");
        }
        return EnrichmentOutcome.success(selectBestLabel(scores));
    }

    /**
     * Picks the label with the strictly highest score. Ties keep the first label seen;
     * when no score is above zero the label stays neutral.
     */
    static String selectBestLabel(List<LabelScore> scores) {
        double highestScore = 0.0;
        String bestLabel = NEUTRAL;
        for (LabelScore candidate : scores) {
            if (candidate.score() > highestScore) {
                highestScore = candidate.score();
                bestLabel = candidate.label();
            }
        }
        return bestLabel;
    }
}
