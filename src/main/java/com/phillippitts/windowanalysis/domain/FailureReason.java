package com.phillippitts.windowanalysis.domain;

/**
 * Why a requested provider did not contribute to a synthesized result.
 */
public enum FailureReason {
    /** Local rate-limit budget exhausted before the call was made. */
    RATE_LIMITED(true),
    /** Bad credentials, malformed request or unsupported payload. */
    PERMANENT_FAILURE(false),
    /** Transient failures on every allowed attempt. */
    EXHAUSTED(true),
    /** Still running when the request deadline elapsed. */
    TIMED_OUT(true),
    /** Call succeeded but nothing usable was extracted. */
    NO_CONTRIBUTION(false),
    /** No adapter is registered for the requested provider id. */
    NOT_CONFIGURED(false);

    private final boolean retryable;

    FailureReason(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether resubmitting the same request later could plausibly succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
