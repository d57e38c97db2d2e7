package com.phillippitts.windowanalysis.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a provider call returned a usable response (after any retries).
 *
 * @param requestId  analysis the call belonged to
 * @param providerId provider that answered
 * @param attempts   attempts made, including the successful one
 * @param latencyMs  wall time of the whole unit, retries and backoff included
 * @param timestamp  when the unit finished
 */
public record ProviderCallCompletedEvent(
        String requestId,
        String providerId,
        int attempts,
        long latencyMs,
        Instant timestamp
) {}
