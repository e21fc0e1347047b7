package ru.tigran.churnpredictor.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request DTO for {@code POST /predict}.
 *
 * The score is a boxed {@link Integer}: an absent or null score is a validation
 * error, not zero. Range checks live in FeedbackValidator so that they run in a fixed order.
 */
@Schema(description = "Customer rating with optional free-text feedback")
public record PredictRequest(
        @Schema(description = "NLS score, 0..10", example = "6", nullable = true)
        @JsonProperty("nls_score")
        @JsonAlias("rating")
        Integer rating,

        @Schema(description = "Free-text feedback, may be empty", example = "The service was okay.")
        @JsonProperty("feedback_text")
        String feedbackText
) {
    public String feedbackTextOrEmpty() {
        return feedbackText == null ? "" : feedbackText;
    }
}
