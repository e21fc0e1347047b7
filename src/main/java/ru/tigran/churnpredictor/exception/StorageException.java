package ru.tigran.churnpredictor.exception;

/**
 * Thrown when a write to the feedback store fails or returns an unusable result.
 * Fatal for the current request.
 * HTTP status: 500 Internal Server Error
 */
public class StorageException extends ApplicationException {
    public StorageException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }

    public StorageException(String message, String errorCode) {
        super(message, errorCode);
    }
}
