package com.phillippitts.windowanalysis.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisMetricsTest {

    private SimpleMeterRegistry registry;
    private AnalysisMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AnalysisMetrics(registry);
    }

    @Test
    void providerLatencyIsTaggedByProviderAndOutcome() {
        metrics.recordProviderLatency("anthropic", "success", 120);
        metrics.recordProviderLatency("anthropic", "success", 80);
        metrics.recordProviderLatency("anthropic", "exhausted", 900);

        var success = registry.find("analysis.provider.latency")
                .tags("provider", "anthropic", "outcome", "success").timer();
        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(2);
        assertThat(success.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        assertThat(registry.find("analysis.provider.latency").tag("outcome", "exhausted").timer().count())
                .isEqualTo(1);
    }

    @Test
    void countersAccumulate() {
        metrics.incrementProviderOutcome("openai", "rate_limited");
        metrics.incrementRateLimited("openai");
        metrics.recordAttempts("openai", 3);
        metrics.recordAttempts("openai", 1);
        metrics.incrementQueued();
        metrics.incrementQueued();
        metrics.incrementDropped();

        assertThat(registry.get("analysis.provider.outcome").tag("outcome", "rate_limited").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("analysis.provider.rate_limited").tag("provider", "openai").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("analysis.provider.attempts").counter().count()).isEqualTo(4.0);
        assertThat(registry.get("analysis.queue.queued").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("analysis.queue.dropped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void analysisOutcomeRecordsDurationAndCount() {
        metrics.recordAnalysis("partial", 1500);

        assertThat(registry.get("analysis.request.duration").tag("outcome", "partial").timer().count()).isEqualTo(1);
        assertThat(registry.get("analysis.request.outcome").tag("outcome", "partial").counter().count())
                .isEqualTo(1.0);
    }
}
