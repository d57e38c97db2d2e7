package com.phillippitts.windowanalysis.service.retry;

import com.phillippitts.windowanalysis.domain.ProviderCallAttempt;

import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of a retried provider call.
 *
 * @param providerId provider that was called
 * @param status     how the call ended
 * @param response   raw response of the successful attempt, {@code null} otherwise
 * @param attempts   every attempt in order, never empty
 * @param failure    last failure, {@code null} on success
 */
public record RetryResult(
        String providerId,
        Status status,
        String response,
        List<ProviderCallAttempt> attempts,
        Throwable failure
) {

    public enum Status {
        SUCCEEDED,
        PERMANENT_FAILURE,
        EXHAUSTED
    }

    public RetryResult {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(status, "status");
        attempts = List.copyOf(attempts);
        if (attempts.isEmpty()) {
            throw new IllegalArgumentException("attempts must not be empty");
        }
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public ProviderCallAttempt lastAttempt() {
        return attempts.get(attempts.size() - 1);
    }
}
