package ru.tigran.churnpredictor.exception;

import java.util.Arrays;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * The default message is the stable text returned to API callers.
 */
public enum ErrorCode {
    // Validation errors
    MISSING_RATING("MISSING_RATING", "NLS score is required."),
    RATING_OUT_OF_RANGE("RATING_OUT_OF_RANGE", "NLS score must be between 0 and 10."),
    EMPTY_FEEDBACK("EMPTY_FEEDBACK", "Feedback text cannot be empty."),
    INVALID_JSON("INVALID_JSON", "Invalid JSON request body."),
    INVALID_IDENTIFIER("INVALID_IDENTIFIER", "Invalid feedback identifier."),
    IDEMPOTENCY_KEY_TOO_LONG("IDEMPOTENCY_KEY_TOO_LONG", "Idempotency key must be at most 128 characters."),
    IDEMPOTENCY_KEY_REUSED("IDEMPOTENCY_KEY_REUSED", "Idempotency key was already used with a different request."),

    // Request errors
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", "Only POST method is allowed."),
    FEEDBACK_NOT_FOUND("FEEDBACK_NOT_FOUND", "Feedback record not found."),

    // Enrichment errors (never surfaced to callers)
    INFERENCE_FAILED("INFERENCE_FAILED", "Text inference call failed"),

    // Storage errors
    FEEDBACK_STORAGE_FAILED("FEEDBACK_STORAGE_FAILED", "Failed to store customer data."),
    PREDICTION_STORAGE_FAILED("PREDICTION_STORAGE_FAILED", "Failed to store churn prediction."),

    // Internal server errors
    INITIALIZATION_FAILED("INITIALIZATION_FAILED", "Server initialization failed."),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred.");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Resolves the public message for a code carried by an exception.
     * Unknown codes fall back to the generic internal error message.
     */
    public static String publicMessageFor(String code) {
        return Arrays.stream(values())
                .filter(value -> value.code.equals(code))
                .findFirst()
                .orElse(INTERNAL_SERVER_ERROR)
                .getDefaultMessage();
    }
}
