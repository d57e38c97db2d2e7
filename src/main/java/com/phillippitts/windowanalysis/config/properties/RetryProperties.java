package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for transient provider failures.
 *
 * <p>Delay before retry {@code i} (0-based) is {@code baseDelayMs * 2^i}. There is no cap
 * besides {@code maxRetries}.
 */
@Validated
@ConfigurationProperties(prefix = "analysis.retry")
public class RetryProperties {

    @Min(0)
    private final int maxRetries;

    @Min(0)
    private final long baseDelayMs;

    @ConstructorBinding
    public RetryProperties(Integer maxRetries, Long baseDelayMs) {
        this.maxRetries = maxRetries == null ? 3 : maxRetries;
        this.baseDelayMs = baseDelayMs == null ? 1000L : baseDelayMs;
        if (this.maxRetries < 0) {
            throw new IllegalArgumentException("analysis.retry.max-retries must be >= 0");
        }
        if (this.baseDelayMs < 0) {
            throw new IllegalArgumentException("analysis.retry.base-delay-ms must be >= 0");
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }
}
