package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-provider call budget over a rolling window.
 *
 * <p>Properties:
 * <ul>
 *   <li>analysis.rate-limit.window-seconds - rolling window length (default: 60)</li>
 *   <li>analysis.rate-limit.max-calls - calls admitted per provider per window (default: 50)</li>
 *   <li>analysis.rate-limit.overrides.&lt;provider&gt; - per-provider max-calls override</li>
 *   <li>analysis.rate-limit.wait-and-retry-once - on denial, wait once and re-acquire (default: false)</li>
 *   <li>analysis.rate-limit.retry-wait-ms - fixed wait used by wait-and-retry-once (default: 1000)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "analysis.rate-limit")
public class RateLimitProperties {

    @Positive
    private int windowSeconds = 60;

    @Positive
    private int maxCalls = 50;

    private Map<String, Integer> overrides = new HashMap<>();

    private boolean waitAndRetryOnce = false;

    @Min(0)
    private long retryWaitMs = 1000;

    /**
     * Returns the call limit for a provider, honoring overrides.
     */
    public int limitFor(String providerId) {
        Integer override = overrides.get(providerId);
        return override != null && override > 0 ? override : maxCalls;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getMaxCalls() {
        return maxCalls;
    }

    public void setMaxCalls(int maxCalls) {
        this.maxCalls = maxCalls;
    }

    public Map<String, Integer> getOverrides() {
        return overrides;
    }

    public void setOverrides(Map<String, Integer> overrides) {
        this.overrides = overrides;
    }

    public boolean isWaitAndRetryOnce() {
        return waitAndRetryOnce;
    }

    public void setWaitAndRetryOnce(boolean waitAndRetryOnce) {
        this.waitAndRetryOnce = waitAndRetryOnce;
    }

    public long getRetryWaitMs() {
        return retryWaitMs;
    }

    public void setRetryWaitMs(long retryWaitMs) {
        this.retryWaitMs = retryWaitMs;
    }
}
