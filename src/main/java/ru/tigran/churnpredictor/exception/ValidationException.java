package ru.tigran.churnpredictor.exception;

/**
 * Thrown when the incoming prediction command is not acceptable.
 * Examples: missing NLS score, score outside 0..10, blank feedback in strict mode.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage(), errorCode.getCode());
    }
}
