package com.phillippitts.windowanalysis.config;

import com.phillippitts.windowanalysis.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void providerExecutorUsesConfiguredDefaults() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).providerExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(6);
            assertThat(executor.getMaxPoolSize()).isEqualTo(12);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("provider-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void providerExecutorRejectsWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getProvider().setCorePoolSize(1);
        properties.getProvider().setMaxPoolSize(1);
        properties.getProvider().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).providerExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            Runnable blocker = () -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            executor.execute(blocker);
            executor.execute(blocker);

            assertThatThrownBy(() -> executor.execute(blocker))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void eventExecutorRunsOnCallerWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getEvent().setCorePoolSize(1);
        properties.getEvent().setMaxPoolSize(1);
        properties.getEvent().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).eventExecutor();
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> ranOn = new AtomicReference<>();
        try {
            Runnable blocker = () -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            executor.execute(blocker);
            executor.execute(blocker);
            executor.execute(() -> ranOn.set(Thread.currentThread().getName()));

            assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void replayExecutorRunsDrainsOffTheCallingThread() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).replayExecutor();
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<String> ranOn = new AtomicReference<>();
        try {
            assertThat(executor.getMaxPoolSize()).isEqualTo(1);
            executor.execute(() -> {
                ranOn.set(Thread.currentThread().getName());
                done.countDown();
            });

            assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(ranOn.get()).startsWith("replay-pool-").isNotEqualTo(Thread.currentThread().getName());
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void propagatesThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).providerExecutor();
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        try {
            ThreadContext.put("analysisId", "req-42");
            executor.execute(() -> {
                seen.set(ThreadContext.get("analysisId"));
                done.countDown();
            });

            assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("req-42");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorRestoresPreviousContext() {
        ThreadContext.put("analysisId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(
                () -> assertThat(ThreadContext.get("analysisId")).isEqualTo("outer"));
        ThreadContext.put("analysisId", "caller");

        decorated.run();

        assertThat(ThreadContext.get("analysisId")).isEqualTo("caller");
    }
}
