package com.phillippitts.windowanalysis.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a queued request leaves the offline queue without a result.
 *
 * @param requestId dropped request
 * @param attempts  replay attempts made
 * @param reason    short description of the last failure
 * @param timestamp when the request was dropped
 */
public record QueuedRequestDroppedEvent(
        String requestId,
        int attempts,
        String reason,
        Instant timestamp
) {}
