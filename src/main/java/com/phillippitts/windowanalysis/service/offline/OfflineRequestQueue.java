package com.phillippitts.windowanalysis.service.offline;

import com.phillippitts.windowanalysis.config.properties.OfflineProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.RequestStatus;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;
import com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException;
import com.phillippitts.windowanalysis.service.orchestration.AnalysisOrchestrator;
import com.phillippitts.windowanalysis.service.orchestration.event.QueuedRequestDroppedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.RequestQueuedEvent;
import com.phillippitts.windowanalysis.service.retry.Sleeper;
import com.phillippitts.windowanalysis.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Front door for analyses that survives connectivity loss.
 *
 * <p>While online, submissions pass straight through to the {@link AnalysisOrchestrator}. While
 * offline, requests are parked in an ordered queue keyed by request id; resubmitting a queued id
 * replaces the parked request but keeps its place in line. An id that already has a stored result
 * is answered from the store and never queued.
 *
 * <p><b>Replay:</b> on reconnection a drain is handed to the replay executor, so the thread that
 * noticed the reconnect is never held up. The drain walks the queue strictly in enqueue order, one
 * request at a time. Each replay goes through the normal retry policy, and each queued request
 * additionally gets its own replay budget ({@code analysis.offline.max-replay-attempts}). A
 * retryable failure is recorded on the entry together with the earliest instant of its next
 * replay ({@code replayBaseDelayMs * 2^i}); the head of the queue is never overtaken while it
 * waits. If connectivity drops mid-replay, draining stops and the remaining requests stay queued
 * with their attempt counts.
 */
public class OfflineRequestQueue {

    private static final Logger LOG = LogManager.getLogger(OfflineRequestQueue.class);

    private static final long MAX_BACKOFF_MS = Duration.ofHours(1).toMillis();

    private final AnalysisOrchestrator orchestrator;
    private final ConnectivityMonitor monitor;
    private final ApplicationEventPublisher publisher;
    private final Executor replayExecutor;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int maxReplayAttempts;
    private final long replayBaseDelayMs;

    private final Map<String, QueuedRequest> queue = new LinkedHashMap<>();
    private final ReentrantLock queueLock = new ReentrantLock();
    private final ReentrantLock replayLock = new ReentrantLock();

    public OfflineRequestQueue(AnalysisOrchestrator orchestrator,
                               ConnectivityMonitor monitor,
                               ApplicationEventPublisher publisher,
                               OfflineProperties properties,
                               Executor replayExecutor,
                               Sleeper sleeper,
                               Clock clock) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.replayExecutor = Objects.requireNonNull(replayExecutor, "replayExecutor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxReplayAttempts = properties.getMaxReplayAttempts();
        this.replayBaseDelayMs = properties.getReplayBaseDelayMs();
        monitor.addListener(this::scheduleReplay);
    }

    /**
     * Returns the stored result for a known id, resolves the request now when online, or parks it
     * when offline.
     *
     * @throws AllProvidersFailedException if online and no provider contributed
     */
    public SubmissionResult submit(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        Optional<SynthesizedResult> stored = orchestrator.getResult(request.id());
        if (stored.isPresent()) {
            LOG.debug("Request {} already resolved; returning stored result", request.id());
            return SubmissionResult.completed(stored.get());
        }
        if (monitor.isOnline()) {
            return SubmissionResult.completed(orchestrator.submit(request));
        }
        enqueue(request);
        // reconnect may have fired between the check above and the enqueue
        if (monitor.isOnline()) {
            scheduleReplay();
        }
        return SubmissionResult.queued(request.id());
    }

    /**
     * PENDING for queued ids, otherwise whatever the orchestrator reports.
     */
    public RequestStatus statusOf(String requestId) {
        if (isQueued(requestId)) {
            return RequestStatus.PENDING;
        }
        return orchestrator.getStatus(requestId);
    }

    public boolean isQueued(String requestId) {
        queueLock.lock();
        try {
            return queue.containsKey(requestId);
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Queued request ids in replay order.
     */
    public List<String> queuedIds() {
        queueLock.lock();
        try {
            return List.copyOf(queue.keySet());
        } finally {
            queueLock.unlock();
        }
    }

    public int size() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Hands a drain to the replay executor.
     */
    void scheduleReplay() {
        try {
            replayExecutor.execute(this::replay);
        } catch (RejectedExecutionException e) {
            LOG.warn("Replay executor saturated; {} queued request(s) wait for the pending drain: {}",
                    size(), e.getMessage());
        }
    }

    /**
     * Drains the queue in order while online. A concurrent call returns immediately; the running
     * drain picks up anything queued meanwhile, and re-checks the queue after releasing its lock.
     *
     * @return number of requests resolved by this call
     */
    public int replay() {
        int resolved = 0;
        do {
            if (!replayLock.tryLock()) {
                LOG.debug("Replay already running");
                return resolved;
            }
            try {
                resolved += drain();
            } finally {
                replayLock.unlock();
            }
        } while (monitor.isOnline() && size() > 0 && !Thread.currentThread().isInterrupted());
        return resolved;
    }

    private int drain() {
        int resolved = 0;
        LOG.info("Replaying {} queued request(s)", size());
        while (monitor.isOnline()) {
            QueuedRequest head = peek();
            if (head == null) {
                break;
            }
            if (!head.isDue(clock.instant())) {
                long waitMs = Math.max(1, Duration.between(clock.instant(), head.nextAttemptAt()).toMillis());
                if (!pause(waitMs)) {
                    break;
                }
                continue;
            }
            if (replayOnce(head) == ReplayOutcome.RESOLVED) {
                resolved++;
            }
        }
        int left = size();
        if (left > 0) {
            LOG.warn("Replay stopped with {} request(s) still queued", left);
        }
        return resolved;
    }

    private ReplayOutcome replayOnce(QueuedRequest head) {
        int attempt = head.attempts() + 1;
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("analysisId", head.id())) {
            try {
                SynthesizedResult result = orchestrator.submit(head.forReplay(clock.instant()));
                LOG.info("Replayed {} on attempt {}/{} (partial={})",
                        head.id(), attempt, maxReplayAttempts, result.partial());
                remove(head);
                return ReplayOutcome.RESOLVED;
            } catch (AllProvidersFailedException e) {
                if (!e.isRetryable()) {
                    return drop(head, attempt, "non-retryable failure: " + e.getFailures());
                }
                if (attempt >= maxReplayAttempts) {
                    return drop(head, attempt, "replay attempts exhausted: " + e.getFailures());
                }
                long delay = backoffDelayMs(attempt - 1);
                LOG.warn("Replay of {} failed (attempt {}/{}), retrying in {}ms",
                        head.id(), attempt, maxReplayAttempts, delay);
                reschedule(head, head.afterFailedAttempt(clock.instant().plusMillis(delay)));
                return ReplayOutcome.RETRYING;
            } catch (InvalidAnalysisRequestException e) {
                return drop(head, attempt, e.getReason());
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure replaying {}", head.id(), e);
                return drop(head, attempt, LogSanitizer.truncate(String.valueOf(e.getMessage()), 200));
            }
        }
    }

    /**
     * Delay before replay {@code retryIndex + 1} of one request, capped at one hour.
     */
    long backoffDelayMs(int retryIndex) {
        int shift = Math.min(retryIndex, 30);
        long factor = 1L << shift;
        if (replayBaseDelayMs > MAX_BACKOFF_MS / factor) {
            return MAX_BACKOFF_MS;
        }
        return replayBaseDelayMs * factor;
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Replay backoff interrupted; leaving remaining requests queued");
            return false;
        }
    }

    private void enqueue(AnalysisRequest request) {
        boolean replaced;
        int size;
        queueLock.lock();
        try {
            // put() on an existing key keeps its insertion position
            replaced = queue.put(request.id(), new QueuedRequest(request, clock.instant())) != null;
            size = queue.size();
        } finally {
            queueLock.unlock();
        }
        LOG.info("Offline: queued request {} ({} queued{})", request.id(), size, replaced ? ", replaced" : "");
        publisher.publishEvent(new RequestQueuedEvent(request.id(), size, replaced, clock.instant()));
    }

    private QueuedRequest peek() {
        queueLock.lock();
        try {
            Iterator<QueuedRequest> it = queue.values().iterator();
            return it.hasNext() ? it.next() : null;
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Removes the entry only if it was not replaced while being replayed; a replacement keeps the
     * head position and is replayed next.
     */
    private void remove(QueuedRequest head) {
        queueLock.lock();
        try {
            queue.remove(head.id(), head);
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Records a failed replay in place. A replacement submitted meanwhile wins and starts fresh.
     */
    private void reschedule(QueuedRequest head, QueuedRequest failed) {
        queueLock.lock();
        try {
            queue.replace(head.id(), head, failed);
        } finally {
            queueLock.unlock();
        }
    }

    private ReplayOutcome drop(QueuedRequest queued, int attempts, String reason) {
        remove(queued);
        LOG.warn("Dropping queued request {} after {} replay attempt(s): {}", queued.id(), attempts, reason);
        publisher.publishEvent(new QueuedRequestDroppedEvent(queued.id(), attempts, reason, clock.instant()));
        return ReplayOutcome.DROPPED;
    }

    /**
     * Snapshot of queued requests in order, for diagnostics.
     */
    List<QueuedRequest> snapshot() {
        queueLock.lock();
        try {
            return new ArrayList<>(queue.values());
        } finally {
            queueLock.unlock();
        }
    }

    private enum ReplayOutcome {
        RESOLVED,
        DROPPED,
        RETRYING
    }
}
