package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Offline queue replay and connectivity probing.
 *
 * <p>Properties:
 * <ul>
 *   <li>analysis.offline.max-replay-attempts - replays per queued request before it is dropped (default: 3)</li>
 *   <li>analysis.offline.replay-base-delay-ms - backoff base between replays of one request (default: 1000)</li>
 *   <li>analysis.offline.probe-url - HEAD target for the connectivity probe; blank disables probing</li>
 *   <li>analysis.offline.probe-interval-ms - probe period (default: 30000)</li>
 *   <li>analysis.offline.probe-timeout-ms - probe call timeout (default: 5000)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "analysis.offline")
public class OfflineProperties {

    @Positive
    private int maxReplayAttempts = 3;

    @Min(0)
    private long replayBaseDelayMs = 1000;

    private String probeUrl = "";

    @Positive
    private long probeIntervalMs = 30_000;

    @Positive
    private long probeTimeoutMs = 5_000;

    public int getMaxReplayAttempts() {
        return maxReplayAttempts;
    }

    public void setMaxReplayAttempts(int maxReplayAttempts) {
        this.maxReplayAttempts = maxReplayAttempts;
    }

    public long getReplayBaseDelayMs() {
        return replayBaseDelayMs;
    }

    public void setReplayBaseDelayMs(long replayBaseDelayMs) {
        this.replayBaseDelayMs = replayBaseDelayMs;
    }

    public String getProbeUrl() {
        return probeUrl;
    }

    public void setProbeUrl(String probeUrl) {
        this.probeUrl = probeUrl;
    }

    public boolean isProbeEnabled() {
        return probeUrl != null && !probeUrl.isBlank();
    }

    public long getProbeIntervalMs() {
        return probeIntervalMs;
    }

    public void setProbeIntervalMs(long probeIntervalMs) {
        this.probeIntervalMs = probeIntervalMs;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }
}
