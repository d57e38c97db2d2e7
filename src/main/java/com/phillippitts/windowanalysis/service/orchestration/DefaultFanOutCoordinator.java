package com.phillippitts.windowanalysis.service.orchestration;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.domain.NormalizedResult;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;
import com.phillippitts.windowanalysis.exception.CredentialNotFoundException;
import com.phillippitts.windowanalysis.exception.PermanentProviderException;
import com.phillippitts.windowanalysis.service.normalize.ResponseNormalizer;
import com.phillippitts.windowanalysis.service.orchestration.event.AnalysisCompletedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.AnalysisFailedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.ProviderCallCompletedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.ProviderCallFailedEvent;
import com.phillippitts.windowanalysis.service.provider.ProviderAdapter;
import com.phillippitts.windowanalysis.service.provider.ProviderRegistry;
import com.phillippitts.windowanalysis.service.provider.credential.CredentialStore;
import com.phillippitts.windowanalysis.service.ratelimit.RateLimiter;
import com.phillippitts.windowanalysis.service.retry.RetryExecutor;
import com.phillippitts.windowanalysis.service.retry.RetryResult;
import com.phillippitts.windowanalysis.service.retry.Sleeper;
import com.phillippitts.windowanalysis.service.synthesis.Synthesizer;
import com.phillippitts.windowanalysis.util.LogSanitizer;
import com.phillippitts.windowanalysis.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default fan-out coordinator: one concurrent unit per requested provider, joined against the
 * request deadline, then normalized and synthesized.
 *
 * <p>Each unit runs on the provider executor and performs:
 * <ol>
 *   <li>adapter lookup (missing adapter: {@link FailureReason#NOT_CONFIGURED})</li>
 *   <li>{@link RateLimiter#tryAcquire} (denied: {@link FailureReason#RATE_LIMITED}, optionally after
 *       one fixed wait and re-acquire)</li>
 *   <li>credential lookup (missing credential: {@link FailureReason#PERMANENT_FAILURE})</li>
 *   <li>{@link RetryExecutor#execute} around
 *       {@code translateResponse(invoke(translateRequest(...)))}</li>
 *   <li>{@link ResponseNormalizer#normalize} of the extracted text</li>
 * </ol>
 *
 * <p><b>Join semantics:</b> all units are awaited regardless of individual failure. A unit never
 * throws; every failure is converted into a {@link ProviderOutcome}. Units still running at the
 * deadline are cancelled best-effort and recorded as {@link FailureReason#TIMED_OUT}; whatever they
 * return later is discarded.
 *
 * <p><b>Events:</b> per-provider and per-analysis events are published from the calling thread
 * after the join, so abandoned units never publish.
 *
 * @see FanOutCoordinatorBuilder
 */
public class DefaultFanOutCoordinator implements FanOutCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultFanOutCoordinator.class);
    private static final int MESSAGE_MAX = 200;

    private final ProviderRegistry registry;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final CredentialStore credentials;
    private final ResponseNormalizer normalizer;
    private final Synthesizer synthesizer;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final Sleeper sleeper;
    private final Clock clock;
    private final long callTimeoutMs;
    private final boolean waitAndRetryOnce;
    private final long rateLimitWaitMs;

    DefaultFanOutCoordinator(FanOutCoordinatorBuilder b) {
        this.registry = b.registry;
        this.rateLimiter = b.rateLimiter;
        this.retryExecutor = b.retryExecutor;
        this.credentials = b.credentials;
        this.normalizer = b.normalizer;
        this.synthesizer = b.synthesizer;
        this.executor = b.executor;
        this.publisher = b.publisher;
        this.sleeper = b.sleeper;
        this.clock = b.clock;
        this.callTimeoutMs = b.callTimeoutMs;
        this.waitAndRetryOnce = b.waitAndRetryOnce;
        this.rateLimitWaitMs = b.rateLimitWaitMs;
    }

    @Override
    public SynthesizedResult analyze(AnalysisRequest request) {
        long t0 = System.nanoTime();
        List<String> providers = request.providers();
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("analysisId", request.id())) {
            LOG.info("Fanning out analysis {} to providers {}", request.id(), providers);

            List<CompletableFuture<ProviderOutcome>> futures = new ArrayList<>(providers.size());
            for (String providerId : providers) {
                futures.add(submitUnit(request, providerId));
            }

            long waitMs = TimeUtils.millisUntil(clock.instant(), request.deadline());
            boolean deadlineElapsed = false;
            try {
                CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                        .get(waitMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException te) {
                LOG.warn("Analysis {} reached its deadline after {} ms; abandoning unfinished providers",
                        request.id(), waitMs);
                deadlineElapsed = true;
                futures.forEach(f -> f.cancel(true));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                deadlineElapsed = true;
                futures.forEach(f -> f.cancel(true));
            } catch (ExecutionException ee) {
                // Units convert their own failures; collect what completed
            }

            List<ProviderOutcome> outcomes = new ArrayList<>(providers.size());
            for (int i = 0; i < providers.size(); i++) {
                ProviderOutcome outcome = getResultSilently(futures.get(i));
                if (outcome == null) {
                    outcome = ProviderOutcome.failure(providers.get(i),
                            deadlineElapsed ? FailureReason.TIMED_OUT : FailureReason.PERMANENT_FAILURE,
                            0, TimeUtils.elapsedMillis(t0),
                            deadlineElapsed ? "Abandoned at request deadline" : "Unit ended abnormally");
                }
                outcomes.add(outcome);
            }
            return synthesize(request, outcomes, t0);
        }
    }

    private SynthesizedResult synthesize(AnalysisRequest request, List<ProviderOutcome> outcomes, long t0) {
        List<NormalizedResult> results = new ArrayList<>();
        Map<String, FailureReason> failures = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (ProviderOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                results.add(outcome.result());
                publisher.publishEvent(new ProviderCallCompletedEvent(request.id(), outcome.providerId(),
                        outcome.attempts(), outcome.latencyMs(), now));
            } else {
                failures.put(outcome.providerId(), outcome.failure());
                publisher.publishEvent(new ProviderCallFailedEvent(request.id(), outcome.providerId(),
                        outcome.failure(), outcome.attempts(), outcome.latencyMs(), outcome.message(), now));
            }
        }

        try {
            SynthesizedResult result = synthesizer.synthesize(request.id(), request.providers(), results, failures);
            long ms = TimeUtils.elapsedMillis(t0);
            publisher.publishEvent(new AnalysisCompletedEvent(result, ms, clock.instant()));
            return result;
        } catch (AllProvidersFailedException e) {
            long ms = TimeUtils.elapsedMillis(t0);
            LOG.warn("Analysis {} failed: no provider contributed ({})", request.id(), e.getFailures());
            publisher.publishEvent(new AnalysisFailedEvent(request.id(), e.getFailures(), e.isRetryable(),
                    ms, clock.instant()));
            throw e;
        }
    }

    private CompletableFuture<ProviderOutcome> submitUnit(AnalysisRequest request, String providerId) {
        try {
            return CompletableFuture.supplyAsync(() -> runUnit(request, providerId), executor);
        } catch (RejectedExecutionException ree) {
            LOG.warn("Provider executor saturated; {} not called for analysis {}", providerId, request.id());
            return CompletableFuture.completedFuture(ProviderOutcome.failure(providerId,
                    FailureReason.EXHAUSTED, 0, 0, "Provider executor saturated"));
        }
    }

    private ProviderOutcome getResultSilently(CompletableFuture<ProviderOutcome> f) {
        try {
            return f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled() ? f.get() : null;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException ee) {
            return null;
        }
    }

    ProviderOutcome runUnit(AnalysisRequest request, String providerId) {
        long t0 = System.nanoTime();
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext
                .put("analysisId", request.id())
                .put("provider", providerId)) {
            ProviderAdapter adapter = registry.find(providerId).orElse(null);
            if (adapter == null) {
                LOG.warn("No adapter configured for provider {}", providerId);
                return ProviderOutcome.failure(providerId, FailureReason.NOT_CONFIGURED, 0,
                        TimeUtils.elapsedMillis(t0), "Provider not configured");
            }

            if (!acquire(providerId)) {
                return ProviderOutcome.failure(providerId, FailureReason.RATE_LIMITED, 0,
                        TimeUtils.elapsedMillis(t0), "Local rate limit of " + rateLimiter.limitFor(providerId)
                                + " calls per window reached");
            }

            String credential;
            try {
                credential = credentials.getCredential(adapter.credentialName());
            } catch (CredentialNotFoundException e) {
                LOG.warn("Provider {} skipped: {}", providerId, e.getMessage());
                return ProviderOutcome.failure(providerId, FailureReason.PERMANENT_FAILURE, 0,
                        TimeUtils.elapsedMillis(t0), e.getMessage());
            }

            RetryResult retry = retryExecutor.execute(providerId,
                    () -> callOnce(adapter, request, credential), adapter::isTransientFailure);
            long ms = TimeUtils.elapsedMillis(t0);

            if (!retry.succeeded()) {
                FailureReason reason = deadlinePassed(request) ? FailureReason.TIMED_OUT
                        : retry.status() == RetryResult.Status.EXHAUSTED ? FailureReason.EXHAUSTED
                        : FailureReason.PERMANENT_FAILURE;
                String message = retry.failure() == null ? null
                        : LogSanitizer.truncate(retry.failure().getMessage(), MESSAGE_MAX);
                return ProviderOutcome.failure(providerId, reason, retry.attemptCount(), ms, message);
            }

            NormalizedResult normalized = normalizer.normalize(providerId, retry.response());
            LOG.debug("Provider {} answered in {} ms after {} attempt(s)", providerId, ms, retry.attemptCount());
            return ProviderOutcome.success(providerId, normalized, retry.attemptCount(), ms);
        } catch (RuntimeException re) {
            LOG.error("Provider {} unit failed unexpectedly", providerId, re);
            return ProviderOutcome.failure(providerId, FailureReason.PERMANENT_FAILURE, 0,
                    TimeUtils.elapsedMillis(t0), LogSanitizer.truncate(re.getMessage(), MESSAGE_MAX));
        }
    }

    private String callOnce(ProviderAdapter adapter, AnalysisRequest request, String credential) {
        long remaining = TimeUtils.millisUntil(clock.instant(), request.deadline());
        if (remaining <= 0) {
            throw new PermanentProviderException("Request deadline elapsed before the call", adapter.providerId());
        }
        long timeoutMs = Math.min(callTimeoutMs, remaining);
        return adapter.translateResponse(adapter.invoke(adapter.translateRequest(request, credential), timeoutMs));
    }

    private boolean acquire(String providerId) {
        if (rateLimiter.tryAcquire(providerId)) {
            return true;
        }
        if (!waitAndRetryOnce) {
            LOG.info("Provider {} rate limited locally", providerId);
            return false;
        }
        try {
            sleeper.sleep(rateLimitWaitMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
        boolean granted = rateLimiter.tryAcquire(providerId);
        if (!granted) {
            LOG.info("Provider {} still rate limited after waiting {} ms", providerId, rateLimitWaitMs);
        }
        return granted;
    }

    private boolean deadlinePassed(AnalysisRequest request) {
        return !clock.instant().isBefore(request.deadline());
    }
}
