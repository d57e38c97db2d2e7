package com.phillippitts.windowanalysis.service.provider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of configured provider adapters by provider id.
 */
public class ProviderRegistry {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderAdapter> adapters;

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        Map<String, ProviderAdapter> byId = new LinkedHashMap<>();
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = byId.putIfAbsent(adapter.providerId(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter for provider " + adapter.providerId());
            }
        }
        this.adapters = Collections.unmodifiableMap(byId);
        LOG.info("Provider registry initialized with providers={}", this.adapters.keySet());
    }

    public Optional<ProviderAdapter> find(String providerId) {
        return Optional.ofNullable(adapters.get(providerId));
    }

    public Set<String> providerIds() {
        return adapters.keySet();
    }

    public boolean isConfigured(String providerId) {
        return adapters.containsKey(providerId);
    }
}
