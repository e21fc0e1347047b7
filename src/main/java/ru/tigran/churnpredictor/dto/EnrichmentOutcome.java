package ru.tigran.churnpredictor.dto;

import java.util.Optional;

/**
 * Result of one enrichment sub-operation.
 *
 * Either a value produced by the inference service, or a safe default with the cause of the
 * degradation. The value is never null, so callers can use it without branching.
 *
 * @param value     the inferred value or the degraded default
 * @param degraded  true when {@code value} is a default substituted for a failed call
 * @param cause     short description of the failure, null when not degraded
 * @param <T>       value type
 */
public record EnrichmentOutcome<T>(T value, boolean degraded, String cause) {

    public static <T> EnrichmentOutcome<T> success(T value) {
        return new EnrichmentOutcome<>(value, false, null);
    }

    public static <T> EnrichmentOutcome<T> degraded(T fallback, String cause) {
        return new EnrichmentOutcome<>(fallback, true, cause);
    }

    public Optional<String> failureCause() {
        return Optional.ofNullable(cause);
    }
}
