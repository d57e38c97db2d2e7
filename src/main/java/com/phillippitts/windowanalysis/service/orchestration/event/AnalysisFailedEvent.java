package com.phillippitts.windowanalysis.service.orchestration.event;

import com.phillippitts.windowanalysis.domain.FailureReason;

import java.time.Instant;
import java.util.Map;

/**
 * Emitted when no provider contributed to an analysis.
 *
 * @param requestId  failed analysis
 * @param failures   reason per requested provider
 * @param retryable  whether resubmission could succeed
 * @param durationMs time from fan-out to failure
 * @param timestamp  when the failure was recorded
 */
public record AnalysisFailedEvent(
        String requestId,
        Map<String, FailureReason> failures,
        boolean retryable,
        long durationMs,
        Instant timestamp
) {
    public AnalysisFailedEvent {
        failures = Map.copyOf(failures);
    }
}
