package com.phillippitts.windowanalysis.service.events;

import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.service.metrics.AnalysisMetrics;
import com.phillippitts.windowanalysis.service.orchestration.event.AnalysisCompletedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.AnalysisFailedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.ProviderCallCompletedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.ProviderCallFailedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.QueuedRequestDroppedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.RequestQueuedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Subscribes to analysis events and turns them into metrics and audit log lines.
 * Handlers run on the {@code eventExecutor} pool, off the fan-out and request threads.
 * Repeated provider failures are throttled to avoid log spam.
 */
@Component
class AnalysisEventsListener {
    private static final Logger LOG = LogManager.getLogger(AnalysisEventsListener.class);
    private static final Logger AUDIT = LogManager.getLogger("analysis.audit");

    static final String SUCCESS = "success";

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    private final AnalysisMetrics metrics;
    private final Clock clock;

    AnalysisEventsListener(AnalysisMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    void onProviderCompleted(ProviderCallCompletedEvent e) {
        metrics.recordProviderLatency(e.providerId(), SUCCESS, e.latencyMs());
        metrics.incrementProviderOutcome(e.providerId(), SUCCESS);
        metrics.recordAttempts(e.providerId(), e.attempts());
    }

    @Async("eventExecutor")
    @EventListener
    void onProviderFailed(ProviderCallFailedEvent e) {
        String outcome = tag(e.reason());
        metrics.recordProviderLatency(e.providerId(), outcome, e.latencyMs());
        metrics.incrementProviderOutcome(e.providerId(), outcome);
        if (e.attempts() > 0) {
            metrics.recordAttempts(e.providerId(), e.attempts());
        }
        if (e.reason() == FailureReason.RATE_LIMITED) {
            metrics.incrementRateLimited(e.providerId());
        }
        if (shouldLog("provider-" + e.providerId() + '-' + outcome)) {
            LOG.warn("Provider {} excluded: reason={}, attempts={}, detail={}",
                    e.providerId(), e.reason(), e.attempts(), e.message());
        }
    }

    @Async("eventExecutor")
    @EventListener
    void onAnalysisCompleted(AnalysisCompletedEvent e) {
        SynthesizedResult r = e.result();
        metrics.recordAnalysis(r.partial() ? "partial" : "complete", e.durationMs());
        AUDIT.info("analysis={} outcome={} confidence={} contributing={} failed={} durationMs={}",
                r.requestId(), r.partial() ? "partial" : "complete", r.aggregateConfidence(),
                r.contributingProviders(), r.failedProviders(), e.durationMs());
    }

    @Async("eventExecutor")
    @EventListener
    void onAnalysisFailed(AnalysisFailedEvent e) {
        metrics.recordAnalysis("failed", e.durationMs());
        AUDIT.info("analysis={} outcome=failed retryable={} failed={} durationMs={}",
                e.requestId(), e.retryable(), e.failures(), e.durationMs());
    }

    @Async("eventExecutor")
    @EventListener
    void onRequestQueued(RequestQueuedEvent e) {
        metrics.incrementQueued();
        AUDIT.info("analysis={} outcome=queued queueSize={} replaced={}", e.requestId(), e.queueSize(), e.replaced());
    }

    @Async("eventExecutor")
    @EventListener
    void onQueuedRequestDropped(QueuedRequestDroppedEvent e) {
        metrics.incrementDropped();
        AUDIT.info("analysis={} outcome=dropped attempts={} reason={}", e.requestId(), e.attempts(), e.reason());
    }

    static String tag(FailureReason reason) {
        return reason.name().toLowerCase(Locale.ROOT);
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
