package com.phillippitts.windowanalysis.config;

import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.service.provider.AnthropicVisionAdapter;
import com.phillippitts.windowanalysis.service.provider.LabelDetectionAdapter;
import com.phillippitts.windowanalysis.service.provider.OpenAiVisionAdapter;
import com.phillippitts.windowanalysis.service.provider.ProviderAdapter;
import com.phillippitts.windowanalysis.service.provider.ProviderIds;
import com.phillippitts.windowanalysis.service.provider.ProviderRegistry;
import com.phillippitts.windowanalysis.service.provider.credential.CachingCredentialStore;
import com.phillippitts.windowanalysis.service.provider.credential.EnvironmentCredentialStore;
import com.phillippitts.windowanalysis.service.provider.transport.OkHttpProviderTransport;
import com.phillippitts.windowanalysis.service.provider.transport.ProviderTransport;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Wires the provider transport, credential store and one adapter per enabled provider.
 */
@Configuration
public class ProviderConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderConfig.class);

    /**
     * Shared HTTP client. Per-call deadlines are applied on each call, so the client-level
     * timeouts only bound connection setup.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.SECONDS)
                .writeTimeout(0, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public ProviderTransport providerTransport(OkHttpClient okHttpClient) {
        return new OkHttpProviderTransport(okHttpClient);
    }

    @Bean
    public CachingCredentialStore credentialStore(Environment environment) {
        return new CachingCredentialStore(new EnvironmentCredentialStore(environment));
    }

    @Bean
    public ProviderRegistry providerRegistry(ProviderProperties properties, ProviderTransport transport) {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (Map.Entry<String, ProviderProperties.Settings> e : properties.asMap().entrySet()) {
            if (!e.getValue().isEnabled()) {
                LOG.info("Provider {} disabled by configuration", e.getKey());
                continue;
            }
            adapters.add(createAdapter(e.getKey(), e.getValue(), transport));
        }
        ProviderRegistry registry = new ProviderRegistry(adapters);
        LOG.info("Registered providers: {}", registry.providerIds());
        return registry;
    }

    static ProviderAdapter createAdapter(String providerId, ProviderProperties.Settings settings,
                                         ProviderTransport transport) {
        return switch (providerId) {
            case ProviderIds.ANTHROPIC -> new AnthropicVisionAdapter(settings, transport);
            case ProviderIds.OPENAI -> new OpenAiVisionAdapter(settings, transport);
            case ProviderIds.GOOGLE_VISION -> new LabelDetectionAdapter(settings, transport);
            default -> throw new IllegalArgumentException("Unknown provider id: " + providerId);
        };
    }
}
