package com.phillippitts.windowanalysis.service.orchestration.event;

import com.phillippitts.windowanalysis.domain.FailureReason;

import java.time.Instant;

/**
 * Emitted when a provider was excluded from an analysis.
 *
 * @param requestId  analysis the call belonged to
 * @param providerId provider that failed
 * @param reason     why it was excluded
 * @param attempts   attempts made (0 when the call never started)
 * @param latencyMs  wall time of the unit
 * @param message    sanitized failure detail, may be {@code null}
 * @param timestamp  when the failure was recorded
 */
public record ProviderCallFailedEvent(
        String requestId,
        String providerId,
        FailureReason reason,
        int attempts,
        long latencyMs,
        String message,
        Instant timestamp
) {}
