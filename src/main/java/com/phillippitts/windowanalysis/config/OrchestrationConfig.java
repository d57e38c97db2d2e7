package com.phillippitts.windowanalysis.config;

import com.phillippitts.windowanalysis.config.properties.NormalizerProperties;
import com.phillippitts.windowanalysis.config.properties.OfflineProperties;
import com.phillippitts.windowanalysis.config.properties.OrchestrationProperties;
import com.phillippitts.windowanalysis.config.properties.RateLimitProperties;
import com.phillippitts.windowanalysis.config.properties.RetryProperties;
import com.phillippitts.windowanalysis.config.properties.StoreProperties;
import com.phillippitts.windowanalysis.service.normalize.DefaultResponseNormalizer;
import com.phillippitts.windowanalysis.service.normalize.ResponseNormalizer;
import com.phillippitts.windowanalysis.service.offline.ConnectivityMonitor;
import com.phillippitts.windowanalysis.service.offline.ConnectivityProbe;
import com.phillippitts.windowanalysis.service.offline.DefaultConnectivityMonitor;
import com.phillippitts.windowanalysis.service.offline.OfflineRequestQueue;
import com.phillippitts.windowanalysis.service.orchestration.AnalysisOrchestrator;
import com.phillippitts.windowanalysis.service.orchestration.DefaultAnalysisOrchestrator;
import com.phillippitts.windowanalysis.service.orchestration.FanOutCoordinator;
import com.phillippitts.windowanalysis.service.orchestration.FanOutCoordinatorBuilder;
import com.phillippitts.windowanalysis.service.persistence.AnalysisStore;
import com.phillippitts.windowanalysis.service.persistence.InMemoryAnalysisStore;
import com.phillippitts.windowanalysis.service.provider.ProviderRegistry;
import com.phillippitts.windowanalysis.service.provider.credential.CredentialStore;
import com.phillippitts.windowanalysis.service.ratelimit.RateLimiter;
import com.phillippitts.windowanalysis.service.ratelimit.SlidingWindowRateLimiter;
import com.phillippitts.windowanalysis.service.retry.RetryExecutor;
import com.phillippitts.windowanalysis.service.retry.Sleeper;
import com.phillippitts.windowanalysis.service.synthesis.PriorityConsensusSynthesizer;
import com.phillippitts.windowanalysis.service.synthesis.ProviderPriority;
import com.phillippitts.windowanalysis.service.synthesis.Synthesizer;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the analysis pipeline: rate limiter, retry executor, normalizer, synthesizer,
 * fan-out coordinator, orchestrator and the offline queue in front of it.
 */
@Configuration
public class OrchestrationConfig {

    private final OrchestrationProperties orchestrationProperties;
    private final RateLimitProperties rateLimitProperties;
    private final StoreProperties storeProperties;

    public OrchestrationConfig(OrchestrationProperties orchestrationProperties,
                               RateLimitProperties rateLimitProperties,
                               StoreProperties storeProperties) {
        this.orchestrationProperties = orchestrationProperties;
        this.rateLimitProperties = rateLimitProperties;
        this.storeProperties = storeProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock) {
        return new SlidingWindowRateLimiter(rateLimitProperties, clock);
    }

    @Bean
    public RetryExecutor retryExecutor(RetryProperties retryProperties, Clock clock) {
        return new RetryExecutor(retryProperties, Sleeper.THREAD_SLEEP, clock);
    }

    @Bean
    public ResponseNormalizer responseNormalizer(NormalizerProperties normalizerProperties) {
        return new DefaultResponseNormalizer(normalizerProperties);
    }

    @Bean
    public Synthesizer synthesizer(Clock clock) {
        return new PriorityConsensusSynthesizer(
                new ProviderPriority(orchestrationProperties.getProviderPriority()), clock);
    }

    @Bean
    public FanOutCoordinator fanOutCoordinator(ProviderRegistry registry,
                                               RateLimiter rateLimiter,
                                               RetryExecutor retryExecutor,
                                               CredentialStore credentialStore,
                                               ResponseNormalizer normalizer,
                                               Synthesizer synthesizer,
                                               @Qualifier("providerExecutor") Executor providerExecutor,
                                               ApplicationEventPublisher publisher,
                                               Clock clock) {
        return FanOutCoordinatorBuilder.builder()
                .registry(registry)
                .rateLimiter(rateLimiter)
                .retryExecutor(retryExecutor)
                .credentials(credentialStore)
                .normalizer(normalizer)
                .synthesizer(synthesizer)
                .executor(providerExecutor)
                .publisher(publisher)
                .clock(clock)
                .orchestrationProperties(orchestrationProperties)
                .rateLimitProperties(rateLimitProperties)
                .build();
    }

    @Bean
    public AnalysisStore analysisStore(Clock clock) {
        return new InMemoryAnalysisStore(storeProperties, clock);
    }

    @Bean
    public AnalysisOrchestrator analysisOrchestrator(FanOutCoordinator coordinator, AnalysisStore store, Clock clock) {
        return new DefaultAnalysisOrchestrator(coordinator, store, orchestrationProperties, storeProperties, clock);
    }

    @Bean
    public ConnectivityMonitor connectivityMonitor() {
        return new DefaultConnectivityMonitor();
    }

    @Bean
    public ConnectivityProbe connectivityProbe(OkHttpClient okHttpClient,
                                               ConnectivityMonitor monitor,
                                               OfflineProperties offlineProperties) {
        return new ConnectivityProbe(okHttpClient, monitor, offlineProperties);
    }

    @Bean
    public OfflineRequestQueue offlineRequestQueue(AnalysisOrchestrator orchestrator,
                                                   ConnectivityMonitor monitor,
                                                   ApplicationEventPublisher publisher,
                                                   OfflineProperties offlineProperties,
                                                   @Qualifier("replayExecutor") Executor replayExecutor,
                                                   Clock clock) {
        return new OfflineRequestQueue(orchestrator, monitor, publisher, offlineProperties,
                replayExecutor, Sleeper.THREAD_SLEEP, clock);
    }
}
