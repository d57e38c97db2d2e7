package com.phillippitts.windowanalysis.service.retry;

import com.phillippitts.windowanalysis.config.properties.RetryProperties;
import com.phillippitts.windowanalysis.domain.CallOutcome;
import com.phillippitts.windowanalysis.domain.ProviderCallAttempt;
import com.phillippitts.windowanalysis.exception.ProviderExhaustedException;
import com.phillippitts.windowanalysis.exception.TransportException;
import com.phillippitts.windowanalysis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Runs a provider call with bounded exponential-backoff retry.
 *
 * <p>Only failures the supplied predicate classifies as transient are retried. A permanent
 * failure ends the call after one attempt. With {@code maxRetries = n} a call makes at most
 * {@code n + 1} attempts; the delay before retry {@code i} (0-based) is {@code baseDelay * 2^i}.
 *
 * <p>The executor never throws for a provider failure. It returns a {@link RetryResult}
 * so one provider's exhaustion can't abort its siblings.
 *
 * <p>Thread-safe: holds no per-call state.
 */
public class RetryExecutor {

    private static final Logger LOG = LogManager.getLogger(RetryExecutor.class);

    private final int maxRetries;
    private final long baseDelayMs;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(RetryProperties properties, Sleeper sleeper, Clock clock) {
        this(properties.getMaxRetries(), properties.getBaseDelayMs(), sleeper, clock);
    }

    public RetryExecutor(int maxRetries, long baseDelayMs, Sleeper sleeper, Clock clock) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Executes the call, retrying transient failures.
     *
     * @param providerId  provider being called (for attempt records and logs)
     * @param call        the call to run on each attempt
     * @param isTransient classifies a failure; {@code true} means retry
     * @return success with the raw response, or the terminal failure with every attempt made
     */
    public RetryResult execute(String providerId, ProviderCall call, Predicate<Throwable> isTransient) {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(isTransient, "isTransient");

        List<ProviderCallAttempt> attempts = new ArrayList<>(maxRetries + 1);
        Throwable lastFailure = null;

        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            Instant startedAt = clock.instant();
            try {
                String response = call.call();
                attempts.add(new ProviderCallAttempt(providerId, attempt, startedAt, CallOutcome.SUCCESS,
                        elapsedMs(startedAt), response, null));
                if (attempt > 1) {
                    LOG.info("Provider {} succeeded on attempt {}/{}", providerId, attempt, maxRetries + 1);
                }
                return new RetryResult(providerId, RetryResult.Status.SUCCEEDED, response, attempts, null);
            } catch (Exception e) {
                lastFailure = e;
                boolean transientFailure = classify(isTransient, e);
                CallOutcome outcome = !transientFailure ? CallOutcome.PERMANENT_FAILURE
                        : isTimeout(e) ? CallOutcome.TIMEOUT
                        : CallOutcome.TRANSIENT_FAILURE;
                attempts.add(new ProviderCallAttempt(providerId, attempt, startedAt, outcome,
                        elapsedMs(startedAt), null, LogSanitizer.truncate(e.getMessage(), 200)));

                if (!transientFailure) {
                    LOG.warn("Provider {} failed permanently on attempt {}: {}",
                            providerId, attempt, LogSanitizer.truncate(e.getMessage(), 200));
                    return new RetryResult(providerId, RetryResult.Status.PERMANENT_FAILURE, null, attempts, e);
                }

                if (attempt > maxRetries) {
                    break;
                }

                long delay = backoffDelayMs(attempt - 1);
                LOG.warn("Provider {} transient failure (attempt {}/{}), retrying in {}ms: {}",
                        providerId, attempt, maxRetries + 1, delay, LogSanitizer.truncate(e.getMessage(), 200));
                if (!pause(providerId, delay)) {
                    break;
                }
            }
        }

        LOG.warn("Provider {} exhausted after {} attempts", providerId, attempts.size());
        return new RetryResult(providerId, RetryResult.Status.EXHAUSTED, null, attempts,
                new ProviderExhaustedException(providerId, attempts.size(), lastFailure));
    }

    /**
     * Delay before the retry with the given 0-based index: {@code baseDelay * 2^retryIndex}.
     */
    public long backoffDelayMs(int retryIndex) {
        int shift = Math.min(retryIndex, 30);
        long factor = 1L << shift;
        if (baseDelayMs > Long.MAX_VALUE / factor) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs * factor;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private boolean classify(Predicate<Throwable> isTransient, Exception e) {
        try {
            return isTransient.test(e);
        } catch (RuntimeException classifierFailure) {
            LOG.error("Failure classifier threw; treating failure as permanent", classifierFailure);
            return false;
        }
    }

    /**
     * Sleeps for the backoff delay. Returns false if the thread was interrupted, in which case
     * no further attempts are made and the interrupt flag is restored.
     */
    private boolean pause(String providerId, long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Retry backoff interrupted for provider {}; abandoning further attempts", providerId);
            return false;
        }
    }

    private long elapsedMs(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }

    static boolean isTimeout(Throwable t) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof TransportException te && te.isTimeout()) {
                return true;
            }
            if (cur instanceof InterruptedIOException || cur instanceof TimeoutException) {
                return true;
            }
            cur = cur.getCause();
        }
        return false;
    }
}
