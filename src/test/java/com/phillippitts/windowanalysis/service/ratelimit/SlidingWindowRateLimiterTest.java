package com.phillippitts.windowanalysis.service.ratelimit;

import com.phillippitts.windowanalysis.config.properties.RateLimitProperties;
import com.phillippitts.windowanalysis.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;
    private RateLimitProperties props;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        props = new RateLimitProperties();
        props.setWindowSeconds(60);
        props.setMaxCalls(3);
    }

    @Test
    void deniesCallsBeyondLimitWithinWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(props, clock);

        assertThat(limiter.tryAcquire("anthropic")).isTrue();
        assertThat(limiter.tryAcquire("anthropic")).isTrue();
        assertThat(limiter.tryAcquire("anthropic")).isTrue();
        assertThat(limiter.tryAcquire("anthropic")).isFalse();
        assertThat(limiter.remainingQuota("anthropic")).isZero();
        assertThat(limiter.recordedCalls("anthropic")).isEqualTo(3);
    }

    @Test
    void budgetReturnsOnceOldestCallLeavesWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(props, clock);
        limiter.tryAcquire("openai");
        clock.advance(Duration.ofSeconds(30));
        limiter.tryAcquire("openai");
        limiter.tryAcquire("openai");
        assertThat(limiter.tryAcquire("openai")).isFalse();

        // first call is exactly one window old: evicted
        clock.advance(Duration.ofSeconds(30));
        assertThat(limiter.remainingQuota("openai")).isEqualTo(1);
        assertThat(limiter.tryAcquire("openai")).isTrue();
        assertThat(limiter.tryAcquire("openai")).isFalse();
    }

    @Test
    void providersHaveIndependentBudgets() {
        props.setOverrides(Map.of("google-vision", 1));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(props, clock);

        assertThat(limiter.tryAcquire("google-vision")).isTrue();
        assertThat(limiter.tryAcquire("google-vision")).isFalse();
        assertThat(limiter.tryAcquire("anthropic")).isTrue();
        assertThat(limiter.limitFor("google-vision")).isEqualTo(1);
        assertThat(limiter.limitFor("anthropic")).isEqualTo(3);
    }

    @Test
    void untouchedProviderReportsFullQuota() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(props, clock);
        assertThat(limiter.remainingQuota("openai")).isEqualTo(3);
        assertThat(limiter.recordedCalls("openai")).isZero();
        assertThat(limiter.windowDuration()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void concurrentBurstGrantsExactlyTheLimit() throws Exception {
        props.setMaxCalls(10);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(props, clock);
        int callers = 11;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return limiter.tryAcquire("anthropic");
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(10);
            assertThat(limiter.recordedCalls("anthropic")).isEqualTo(10);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new RateLimitWindow("anthropic", Duration.ofSeconds(60), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anthropic");
    }
}
