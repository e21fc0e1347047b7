package ru.tigran.churnpredictor.exception;

/**
 * Thrown when required configuration is missing at startup.
 * HTTP status: 500 Internal Server Error
 */
public class InitializationException extends ApplicationException {
    public InitializationException(String message) {
        super(message, ErrorCode.INITIALIZATION_FAILED.getCode());
    }
}
