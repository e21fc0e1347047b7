package ru.tigran.churnpredictor.exception;

/**
 * Thrown by the inference gateway when a remote text-inference call fails
 * (transport error, non-2xx status, oversized or unparsable body, open circuit).
 *
 * Never reaches the HTTP layer: the analyzers convert it into a degraded outcome.
 */
public class EnrichmentException extends ApplicationException {
    public EnrichmentException(String message) {
        super(message, ErrorCode.INFERENCE_FAILED.getCode());
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, ErrorCode.INFERENCE_FAILED.getCode(), cause);
    }
}
