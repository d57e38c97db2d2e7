package com.phillippitts.windowanalysis.service.events;

import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.service.metrics.AnalysisMetrics;
import com.phillippitts.windowanalysis.service.orchestration.event.AnalysisCompletedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.AnalysisFailedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.ProviderCallCompletedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.ProviderCallFailedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.QueuedRequestDroppedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.RequestQueuedEvent;
import com.phillippitts.windowanalysis.testutil.MutableClock;
import com.phillippitts.windowanalysis.testutil.TestResults;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisEventsListenerTest {

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private AnalysisEventsListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        listener = new AnalysisEventsListener(new AnalysisMetrics(registry), clock);
    }

    @Test
    void providerSuccessRecordsLatencyOutcomeAndAttempts() {
        listener.onProviderCompleted(new ProviderCallCompletedEvent("req-1", "anthropic", 2, 340, clock.instant()));

        assertThat(registry.get("analysis.provider.outcome").tags("provider", "anthropic", "outcome", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("analysis.provider.attempts").counter().count()).isEqualTo(2.0);
    }

    @Test
    void rateLimitedFailureAlsoCountsAsRateLimited() {
        listener.onProviderFailed(new ProviderCallFailedEvent("req-1", "openai", FailureReason.RATE_LIMITED,
                0, 1, "Local rate limit", clock.instant()));

        assertThat(registry.get("analysis.provider.outcome").tag("outcome", "rate_limited").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("analysis.provider.rate_limited").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("analysis.provider.attempts").counter()).isNull();
    }

    @Test
    void analysisOutcomesAreTagged() {
        listener.onAnalysisCompleted(new AnalysisCompletedEvent(TestResults.result("req-1"), 800, clock.instant()));
        listener.onAnalysisFailed(new AnalysisFailedEvent("req-2", Map.of("openai", FailureReason.EXHAUSTED),
                true, 1200, clock.instant()));

        assertThat(registry.get("analysis.request.outcome").tag("outcome", "complete").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("analysis.request.outcome").tag("outcome", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void queueEventsAreCounted() {
        listener.onRequestQueued(new RequestQueuedEvent("req-1", 1, false, clock.instant()));
        listener.onQueuedRequestDropped(new QueuedRequestDroppedEvent("req-1", 3, "replay attempts exhausted",
                clock.instant()));

        assertThat(registry.get("analysis.queue.queued").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("analysis.queue.dropped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void repeatedFailureLogsAreThrottledPerMinute() {
        assertThat(listener.shouldLog("provider-openai-exhausted")).isTrue();
        assertThat(listener.shouldLog("provider-openai-exhausted")).isFalse();
        assertThat(listener.shouldLog("provider-anthropic-exhausted")).isTrue();

        clock.advance(Duration.ofSeconds(61));
        assertThat(listener.shouldLog("provider-openai-exhausted")).isTrue();
    }

    @Test
    void outcomeTagIsLowerCaseReason() {
        assertThat(AnalysisEventsListener.tag(FailureReason.TIMED_OUT)).isEqualTo("timed_out");
    }
}
