package com.phillippitts.windowanalysis.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for provider calls and analyses.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Provider unit latency per provider and outcome</li>
 *   <li>Provider outcomes per provider (success or failure reason)</li>
 *   <li>Local rate-limit denials per provider</li>
 *   <li>Analysis outcomes (complete, partial, failed) and duration</li>
 *   <li>Offline queue activity (queued, dropped)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AnalysisMetrics {

    private static final String PROVIDER_PREFIX = "analysis.provider";
    private static final String REQUEST_PREFIX = "analysis.request";
    private static final String QUEUE_PREFIX = "analysis.queue";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall time of one provider unit.
     *
     * @param providerId provider id
     * @param outcome    "success" or a lower-case failure reason
     * @param latencyMs  duration in milliseconds
     */
    public void recordProviderLatency(String providerId, String outcome, long latencyMs) {
        Timer.builder(PROVIDER_PREFIX + ".latency")
                .description("Time spent per provider call, retries included")
                .tag("provider", providerId)
                .tag("outcome", outcome)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void incrementProviderOutcome(String providerId, String outcome) {
        Counter.builder(PROVIDER_PREFIX + ".outcome")
                .description("Provider call outcomes")
                .tag("provider", providerId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementRateLimited(String providerId) {
        Counter.builder(PROVIDER_PREFIX + ".rate_limited")
                .description("Provider calls denied by the local rate limiter")
                .tag("provider", providerId)
                .register(registry)
                .increment();
    }

    public void recordAttempts(String providerId, int attempts) {
        Counter.builder(PROVIDER_PREFIX + ".attempts")
                .description("Provider call attempts, retries included")
                .tag("provider", providerId)
                .register(registry)
                .increment(attempts);
    }

    /**
     * Records a finished analysis.
     *
     * @param outcome    complete, partial or failed
     * @param durationMs duration in milliseconds
     */
    public void recordAnalysis(String outcome, long durationMs) {
        Timer.builder(REQUEST_PREFIX + ".duration")
                .description("Time from fan-out to synthesis")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        Counter.builder(REQUEST_PREFIX + ".outcome")
                .description("Analysis outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementQueued() {
        Counter.builder(QUEUE_PREFIX + ".queued")
                .description("Requests parked while offline")
                .register(registry)
                .increment();
    }

    public void incrementDropped() {
        Counter.builder(QUEUE_PREFIX + ".dropped")
                .description("Queued requests dropped without a result")
                .register(registry)
                .increment();
    }
}
