package com.phillippitts.windowanalysis.service.ratelimit;

import com.phillippitts.windowanalysis.config.properties.RateLimitProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory sliding-window rate limiter.
 *
 * <p>Each provider gets its own {@link RateLimitWindow}; windows are created lazily and
 * locked independently, so contention on one provider never blocks another.
 * The window is the only shared mutable state between concurrent provider calls.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger LOG = LogManager.getLogger(SlidingWindowRateLimiter.class);

    private final RateLimitProperties properties;
    private final Clock clock;
    private final ConcurrentMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean tryAcquire(String providerId) {
        Objects.requireNonNull(providerId, "providerId");
        RateLimitWindow window = windowFor(providerId);
        boolean granted = window.tryRecord(clock.instant());
        if (!granted) {
            LOG.debug("Rate limit reached for provider={} (limit={} per {}s)",
                    providerId, window.limit(), window.window().toSeconds());
        }
        return granted;
    }

    @Override
    public int remainingQuota(String providerId) {
        RateLimitWindow window = windows.get(providerId);
        if (window == null) {
            return limitFor(providerId);
        }
        return window.remaining(clock.instant());
    }

    @Override
    public int limitFor(String providerId) {
        return properties.limitFor(providerId);
    }

    /**
     * Window length shared by all providers.
     */
    public Duration windowDuration() {
        return Duration.ofSeconds(properties.getWindowSeconds());
    }

    /** Visible for tests */
    int recordedCalls(String providerId) {
        RateLimitWindow window = windows.get(providerId);
        return window == null ? 0 : window.size();
    }

    private RateLimitWindow windowFor(String providerId) {
        return windows.computeIfAbsent(providerId,
                id -> new RateLimitWindow(id, windowDuration(), properties.limitFor(id)));
    }
}
