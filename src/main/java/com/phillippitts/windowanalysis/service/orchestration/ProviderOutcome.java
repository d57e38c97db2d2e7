package com.phillippitts.windowanalysis.service.orchestration;

import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.domain.NormalizedResult;

import java.util.Objects;

/**
 * What one provider unit produced for an analysis: either a normalized result or a failure reason.
 *
 * @param providerId provider the unit called
 * @param result     normalized result, {@code null} on failure
 * @param failure    failure reason, {@code null} on success
 * @param attempts   attempts made (0 when no call was made)
 * @param latencyMs  wall time of the unit
 * @param message    sanitized failure detail, may be {@code null}
 */
public record ProviderOutcome(
        String providerId,
        NormalizedResult result,
        FailureReason failure,
        int attempts,
        long latencyMs,
        String message
) {

    public ProviderOutcome {
        Objects.requireNonNull(providerId, "providerId");
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of result or failure must be set");
        }
    }

    public static ProviderOutcome success(String providerId, NormalizedResult result, int attempts, long latencyMs) {
        return new ProviderOutcome(providerId, result, null, attempts, latencyMs, null);
    }

    public static ProviderOutcome failure(String providerId, FailureReason reason, int attempts,
                                          long latencyMs, String message) {
        return new ProviderOutcome(providerId, null, reason, attempts, latencyMs, message);
    }

    public boolean succeeded() {
        return result != null;
    }
}
