package com.phillippitts.windowanalysis.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes provider executor pool metrics via Micrometer.
 *
 * <ul>
 *   <li>provider.pool.size - Current number of threads in the pool</li>
 *   <li>provider.pool.active - Number of actively executing provider calls</li>
 *   <li>provider.pool.queued - Number of provider calls waiting in the queue</li>
 *   <li>provider.pool.completed - Cumulative count of completed provider calls</li>
 *   <li>provider.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Prometheus: {@code provider_pool_active}. A health summary is logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> providerExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("providerExecutor") ObjectProvider<ThreadPoolTaskExecutor> providerExecutorProvider) {
        this.providerExecutorProvider = providerExecutorProvider;
    }

    @Bean
    public MeterBinder providerExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.providerExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("provider.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the provider pool")
                    .register(registry);

            Gauge.builder("provider.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively calling providers")
                    .register(registry);

            Gauge.builder("provider.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of provider calls waiting in the queue")
                    .register(registry);

            Gauge.builder("provider.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed provider calls")
                    .register(registry);

            Gauge.builder("provider.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the provider executor")
                    .register(registry);

            LOG.info("Provider thread pool metrics registered: provider.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.providerExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Provider Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
