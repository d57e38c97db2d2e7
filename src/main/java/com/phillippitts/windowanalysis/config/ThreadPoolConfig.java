package com.phillippitts.windowanalysis.config;

import com.phillippitts.windowanalysis.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for provider fan-out, event listener offload and offline queue replay.
 *
 * <p>All pools copy the submitting thread's Log4j2 ThreadContext onto the worker so
 * {@code requestId} and {@code analysisId} survive the hop.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private static final int SHUTDOWN_AWAIT_SECONDS = 30;

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one task per requested provider per analysis.
     *
     * <p>Saturation aborts the submission. The fan-out coordinator records the rejected
     * provider as exhausted; running it on the caller would escape the request deadline.
     */
    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        return newExecutor(threadPoolProperties.getProvider(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs {@code @Async("eventExecutor")} listeners. Saturation falls back to the publishing
     * thread so no metric or audit line is dropped.
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return newExecutor(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Drains the offline queue after a reconnect, off the scheduler thread that detected it.
     * Saturation aborts; an already pending drain covers the rejected one.
     */
    @Bean(name = "replayExecutor")
    public ThreadPoolTaskExecutor replayExecutor() {
        return newExecutor(threadPoolProperties.getReplay(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.Pool pool,
                                                      RejectedExecutionHandler onSaturation) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(onSaturation);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the caller's ThreadContext into the task and restores the worker's own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> callerContext = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> workerContext = ThreadContext.getImmutableContext();
                ThreadContext.putAll(callerContext);
                try {
                    runnable.run();
                } finally {
                    ThreadContext.clearMap();
                    ThreadContext.putAll(workerContext);
                }
            };
        };
    }
}
