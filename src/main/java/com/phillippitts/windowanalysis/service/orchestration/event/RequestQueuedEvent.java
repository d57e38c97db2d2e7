package com.phillippitts.windowanalysis.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a request was parked in the offline queue.
 *
 * @param requestId queued request
 * @param queueSize queue length after the request was added
 * @param replaced  true if an earlier request with the same id was overwritten
 * @param timestamp when the request was queued
 */
public record RequestQueuedEvent(
        String requestId,
        int queueSize,
        boolean replaced,
        Instant timestamp
) {}
