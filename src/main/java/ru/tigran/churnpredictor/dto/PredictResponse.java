package ru.tigran.churnpredictor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Churn prediction for a stored feedback record")
public record PredictResponse(
        @Schema(description = "Identifier of the stored feedback record")
        @JsonProperty("customer_id")
        String customerId,

        @Schema(description = "Heuristic churn probability: 0.1, 0.4 or 0.8", example = "0.4")
        @JsonProperty("churn_probability")
        double churnProbability,

        @Schema(example = "Moderate NLS score or neutral feedback/sentiment.")
        String reason,

        @Schema(description = "Inferred sentiment label", example = "NEUTRAL")
        @JsonProperty("comment_sentiment")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        String commentSentiment,

        @Schema(description = "Topics detected in the feedback")
        @JsonProperty("comment_topics")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<String> commentTopics
) {
}
