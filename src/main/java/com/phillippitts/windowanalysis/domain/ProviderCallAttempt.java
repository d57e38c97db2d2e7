package com.phillippitts.windowanalysis.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one attempt to call a provider, appended by the retry executor.
 *
 * @param providerId   provider that was called
 * @param attempt      1-based attempt number (1..maxRetries+1)
 * @param startedAt    when the attempt started
 * @param outcome      classified outcome
 * @param latencyMs    wall-clock duration of the attempt
 * @param rawResponse  raw wire response on success (nullable)
 * @param errorMessage failure message on failure (nullable)
 */
public record ProviderCallAttempt(
        String providerId,
        int attempt,
        Instant startedAt,
        CallOutcome outcome,
        long latencyMs,
        String rawResponse,
        String errorMessage
) {
    public ProviderCallAttempt {
        Objects.requireNonNull(providerId, "providerId");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(outcome, "outcome");
    }

    public boolean succeeded() {
        return outcome == CallOutcome.SUCCESS;
    }
}
