package com.phillippitts.windowanalysis.service.health;

import com.phillippitts.windowanalysis.service.provider.ProviderAdapter;
import com.phillippitts.windowanalysis.service.provider.ProviderRegistry;
import com.phillippitts.windowanalysis.service.provider.credential.CachingCredentialStore;
import com.phillippitts.windowanalysis.service.ratelimit.RateLimiter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for analysis providers.
 *
 * <p>A provider is ready when its credential resolves and it has rate-limit quota left:
 * <ul>
 *   <li>UP: every configured provider ready</li>
 *   <li>DEGRADED: at least one provider ready</li>
 *   <li>DOWN: no provider ready, or none configured</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderRegistry registry;
    private final RateLimiter rateLimiter;
    private final CachingCredentialStore credentials;

    public ProviderHealthIndicator(ProviderRegistry registry,
                                   RateLimiter rateLimiter,
                                   CachingCredentialStore credentials) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.credentials = credentials;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        int ready = 0;
        for (String providerId : registry.providerIds()) {
            ProviderAdapter adapter = registry.find(providerId).orElseThrow();
            boolean hasCredential = credentials.isAvailable(adapter.credentialName());
            int remaining = rateLimiter.remainingQuota(providerId);
            if (hasCredential && remaining > 0) {
                ready++;
            }
            details.put(providerId, Map.of(
                    "status", buildProviderStatus(hasCredential, remaining),
                    "remainingQuota", remaining,
                    "limit", rateLimiter.limitFor(providerId)));
        }

        int total = registry.providerIds().size();
        Health.Builder builder = new Health.Builder();
        if (total > 0 && ready == total) {
            builder.up().withDetail("status", "All providers operational");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial provider availability");
        } else {
            builder.down().withDetail("status", total == 0 ? "No providers configured" : "No providers available");
        }
        details.forEach(builder::withDetail);
        return builder.build();
    }

    private String buildProviderStatus(boolean hasCredential, int remaining) {
        if (!hasCredential) {
            return "missing-credential";
        }
        return remaining > 0 ? "ready" : "rate-limited";
    }
}
