package ru.tigran.churnpredictor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read model for a stored feedback record and its prediction.
 * {@code prediction} is null for an orphaned record whose prediction write failed.
 */
@Schema(description = "Stored feedback record with its churn prediction")
public record FeedbackRecordResponse(
        UUID id,
        @JsonProperty("nls_score") int rating,
        @JsonProperty("feedback_text") String feedbackText,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("comment_sentiment") String commentSentiment,
        @JsonProperty("comment_topics") List<String> commentTopics,
        PredictionView prediction
) {
    public record PredictionView(
            UUID id,
            @JsonProperty("churn_probability") double churnProbability,
            String reason,
            @JsonProperty("predicted_at") LocalDateTime predictedAt
    ) {
    }
}
