package com.phillippitts.windowanalysis.service.offline;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A request parked while offline, with its replay bookkeeping.
 *
 * @param request       the request as submitted
 * @param enqueuedAt    when it was (last) queued
 * @param attempts      replays already made and failed retryably
 * @param nextAttemptAt earliest instant the next replay may start
 */
public record QueuedRequest(AnalysisRequest request, Instant enqueuedAt, int attempts, Instant nextAttemptAt) {

    public QueuedRequest {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        Objects.requireNonNull(nextAttemptAt, "nextAttemptAt");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, got " + attempts);
        }
    }

    /**
     * A freshly queued request, due immediately.
     */
    public QueuedRequest(AnalysisRequest request, Instant enqueuedAt) {
        this(request, enqueuedAt, 0, enqueuedAt);
    }

    public String id() {
        return request.id();
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextAttemptAt);
    }

    /**
     * Same request with one more failed replay counted and the next replay held back until
     * {@code retryAt}.
     */
    public QueuedRequest afterFailedAttempt(Instant retryAt) {
        return new QueuedRequest(request, enqueuedAt, attempts + 1, retryAt);
    }

    /**
     * Copy of the request with its time budget restarted at {@code now}, so time spent queued
     * does not count against the deadline.
     */
    public AnalysisRequest forReplay(Instant now) {
        Duration budget = Duration.between(request.createdAt(), request.deadline());
        return new AnalysisRequest(request.id(), request.payload(), request.providers(),
                request.context(), now, now.plus(budget));
    }
}
