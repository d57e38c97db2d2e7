package com.phillippitts.windowanalysis.service.orchestration;

import com.phillippitts.windowanalysis.config.properties.OrchestrationProperties;
import com.phillippitts.windowanalysis.config.properties.RateLimitProperties;
import com.phillippitts.windowanalysis.service.normalize.ResponseNormalizer;
import com.phillippitts.windowanalysis.service.provider.ProviderRegistry;
import com.phillippitts.windowanalysis.service.provider.credential.CredentialStore;
import com.phillippitts.windowanalysis.service.ratelimit.RateLimiter;
import com.phillippitts.windowanalysis.service.retry.RetryExecutor;
import com.phillippitts.windowanalysis.service.retry.Sleeper;
import com.phillippitts.windowanalysis.service.synthesis.Synthesizer;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultFanOutCoordinator} to simplify construction with many dependencies.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FanOutCoordinator coordinator = FanOutCoordinatorBuilder.builder()
 *     .registry(registry)
 *     .rateLimiter(rateLimiter)
 *     .retryExecutor(retryExecutor)
 *     .credentials(credentialStore)
 *     .normalizer(normalizer)
 *     .synthesizer(synthesizer)
 *     .executor(providerExecutor)
 *     .publisher(publisher)
 *     .orchestrationProperties(orchestration)   // optional, call timeout
 *     .rateLimitProperties(rateLimits)          // optional, wait-and-retry-once
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class FanOutCoordinatorBuilder {

    private static final long DEFAULT_CALL_TIMEOUT_MS = 30_000;

    ProviderRegistry registry;
    RateLimiter rateLimiter;
    RetryExecutor retryExecutor;
    CredentialStore credentials;
    ResponseNormalizer normalizer;
    Synthesizer synthesizer;
    Executor executor;
    ApplicationEventPublisher publisher;

    // Optional, defaulted in build()
    Sleeper sleeper = Sleeper.THREAD_SLEEP;
    Clock clock = Clock.systemUTC();
    long callTimeoutMs = DEFAULT_CALL_TIMEOUT_MS;
    boolean waitAndRetryOnce;
    long rateLimitWaitMs;

    private FanOutCoordinatorBuilder() {
    }

    public static FanOutCoordinatorBuilder builder() {
        return new FanOutCoordinatorBuilder();
    }

    public FanOutCoordinatorBuilder registry(ProviderRegistry registry) {
        this.registry = registry;
        return this;
    }

    public FanOutCoordinatorBuilder rateLimiter(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
        return this;
    }

    public FanOutCoordinatorBuilder retryExecutor(RetryExecutor retryExecutor) {
        this.retryExecutor = retryExecutor;
        return this;
    }

    public FanOutCoordinatorBuilder credentials(CredentialStore credentials) {
        this.credentials = credentials;
        return this;
    }

    public FanOutCoordinatorBuilder normalizer(ResponseNormalizer normalizer) {
        this.normalizer = normalizer;
        return this;
    }

    public FanOutCoordinatorBuilder synthesizer(Synthesizer synthesizer) {
        this.synthesizer = synthesizer;
        return this;
    }

    public FanOutCoordinatorBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    public FanOutCoordinatorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * Sleeper used for the rate-limit wait (tests pass a recording no-op).
     */
    public FanOutCoordinatorBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    public FanOutCoordinatorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public FanOutCoordinatorBuilder orchestrationProperties(OrchestrationProperties properties) {
        this.callTimeoutMs = properties.getCallTimeoutMs();
        return this;
    }

    public FanOutCoordinatorBuilder rateLimitProperties(RateLimitProperties properties) {
        this.waitAndRetryOnce = properties.isWaitAndRetryOnce();
        this.rateLimitWaitMs = properties.getRetryWaitMs();
        return this;
    }

    public DefaultFanOutCoordinator build() {
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(rateLimiter, "rateLimiter is required");
        Objects.requireNonNull(retryExecutor, "retryExecutor is required");
        Objects.requireNonNull(credentials, "credentials is required");
        Objects.requireNonNull(normalizer, "normalizer is required");
        Objects.requireNonNull(synthesizer, "synthesizer is required");
        Objects.requireNonNull(executor, "executor is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(sleeper, "sleeper is required");
        Objects.requireNonNull(clock, "clock is required");
        if (callTimeoutMs <= 0) {
            throw new IllegalStateException("callTimeoutMs must be positive");
        }
        return new DefaultFanOutCoordinator(this);
    }
}
