package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed properties for multi-provider fan-out.
 *
 * <p>Properties:
 * <ul>
 *   <li>analysis.orchestration.provider-priority - merge order for categorical fields</li>
 *   <li>analysis.orchestration.default-providers - providers used when a request names none</li>
 *   <li>analysis.orchestration.deadline-ms - request-level deadline (default: 60000)</li>
 *   <li>analysis.orchestration.call-timeout-ms - per-call transport timeout (default: 30000)</li>
 *   <li>analysis.orchestration.max-image-bytes - largest accepted image (default: 10 MB)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "analysis.orchestration")
public class OrchestrationProperties {

    /** Merge order for categorical fields; unlisted providers rank after, alphabetically. */
    @NotEmpty
    private List<String> providerPriority = new ArrayList<>(List.of("anthropic", "openai", "google-vision"));

    /** Providers used when a submission does not name any. */
    @NotEmpty
    private List<String> defaultProviders = new ArrayList<>(List.of("anthropic", "openai", "google-vision"));

    @Positive
    private long deadlineMs = 60_000;

    @Positive
    private long callTimeoutMs = 30_000;

    @Positive
    private long maxImageBytes = 10L * 1024 * 1024;

    public List<String> getProviderPriority() {
        return providerPriority;
    }

    public void setProviderPriority(List<String> providerPriority) {
        this.providerPriority = providerPriority;
    }

    public List<String> getDefaultProviders() {
        return defaultProviders;
    }

    public void setDefaultProviders(List<String> defaultProviders) {
        this.defaultProviders = defaultProviders;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public void setDeadlineMs(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }
}
