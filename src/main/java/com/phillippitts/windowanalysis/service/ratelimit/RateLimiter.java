package com.phillippitts.windowanalysis.service.ratelimit;

/**
 * Per-provider call budget over a rolling time window.
 *
 * <p>Denial is immediate. Implementations never queue or delay a caller.
 */
public interface RateLimiter {

    /**
     * Tries to admit one call for the provider, recording it when admitted.
     *
     * @param providerId provider to charge
     * @return true if the call is admitted, false if the window is full
     */
    boolean tryAcquire(String providerId);

    /**
     * Calls still admissible for the provider in the current window.
     */
    int remainingQuota(String providerId);

    /**
     * Configured limit for the provider.
     */
    int limitFor(String providerId);
}
