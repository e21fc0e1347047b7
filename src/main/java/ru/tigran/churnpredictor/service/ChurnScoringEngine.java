package ru.tigran.churnpredictor.service;

import org.springframework.stereotype.Component;
import ru.tigran.churnpredictor.dto.ChurnScore;

import java.util.List;
import java.util.Locale;

/**
 * Rule-based churn scoring.
 *
 * Pure function of (rating, feedback text, sentiment label). Rules are evaluated in order and
 * the first match wins:
 * <ol>
 *     <li>rating &lt; 5 with a negative keyword, or rating &lt; 3 with NEGATIVE sentiment: 0.8</li>
 *     <li>rating &gt;= 8: 0.1</li>
 *     <li>anything else: 0.4</li>
 * </ol>
 * Topics are not an input.
 */
@Component
public class ChurnScoringEngine {

    public static final double HIGH_CHURN_PROBABILITY = 0.8;
    public static final double LOW_CHURN_PROBABILITY = 0.1;
    public static final double MODERATE_CHURN_PROBABILITY = 0.4;

    public static final String HIGH_CHURN_REASON = "Low NLS score and/or negative feedback/sentiment.";
    public static final String LOW_CHURN_REASON = "High NLS score.";
    public static final String MODERATE_CHURN_REASON = "Moderate NLS score or neutral feedback/sentiment.";

    private static final List<String> NEGATIVE_KEYWORDS = List.of("bad", "poor", "terrible", "unhappy");

    public ChurnScore score(int rating, String feedbackText, String sentimentLabel) {
        boolean negativeFeedback = containsNegativeKeyword(feedbackText);
        boolean negativeSentiment = SentimentAnalyzer.NEGATIVE.equalsIgnoreCase(sentimentLabel);

        if ((rating < 5 && negativeFeedback) || (rating < 3 && negativeSentiment)) {
            return new ChurnScore(HIGH_CHURN_PROBABILITY, HIGH_CHURN_REASON);
        }
        if (rating >= 8) {
            return new ChurnScore(LOW_CHURN_PROBABILITY, LOW_CHURN_REASON);
        }
        return new ChurnScore(MODERATE_CHURN_PROBABILITY, MODERATE_CHURN_REASON);
    }

    // Substring match, so "badly" also counts
    static boolean containsNegativeKeyword(String feedbackText) {
        if (feedbackText == null || feedbackText.isEmpty()) {
            return false;
        }
        String lower = feedbackText.toLowerCase(Locale.ROOT);
        return NEGATIVE_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
