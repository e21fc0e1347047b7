package ru.tigran.churnpredictor.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.churnpredictor.dto.PredictRequest;
import ru.tigran.churnpredictor.exception.ErrorCode;
import ru.tigran.churnpredictor.exception.ValidationException;
import ru.tigran.churnpredictor.model.FeedbackRecord;

/**
 * Structural and range checks for a prediction request, applied in a fixed order.
 * Blank feedback is accepted unless {@code app.feedback.require-text} is enabled.
 * The idempotency key is checked last and only when present.
 */
@Component
public class FeedbackValidator {

    static final int MIN_RATING = 0;
    static final int MAX_RATING = 10;

    private final boolean requireText;

    public FeedbackValidator(@Value("${app.feedback.require-text:false}") boolean requireText) {
        this.requireText = requireText;
    }

    public void validate(PredictRequest request) {
        validate(request, null);
    }

    public void validate(PredictRequest request, String idempotencyKey) {
        if (request == null || request.rating() == null) {
            throw new ValidationException(ErrorCode.MISSING_RATING);
        }
        int rating = request.rating();
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new ValidationException(ErrorCode.RATING_OUT_OF_RANGE);
        }
        if (requireText && request.feedbackTextOrEmpty().isBlank()) {
            throw new ValidationException(ErrorCode.EMPTY_FEEDBACK);
        }
        if (idempotencyKey != null && idempotencyKey.length() > FeedbackRecord.IDEMPOTENCY_KEY_MAX_LENGTH) {
            throw new ValidationException(ErrorCode.IDEMPOTENCY_KEY_TOO_LONG);
        }
    }
}
