package ru.tigran.churnpredictor.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries a stable error code; the HTTP status and public message are resolved from it
 * by {@link GlobalExceptionHandler}.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;

    public ApplicationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApplicationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
