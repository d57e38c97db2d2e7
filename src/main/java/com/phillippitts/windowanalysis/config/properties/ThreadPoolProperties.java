package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing for the application executors.
 *
 * <p>The provider pool runs one task per requested provider per analysis, so its max size
 * bounds how many provider calls are in flight at once. The event pool runs metrics and
 * audit listeners off the publishing thread. The replay pool drains the offline queue; one
 * thread is enough since drains are serialized.
 *
 * <pre>
 * threadpool.provider.core-pool-size=6
 * threadpool.provider.max-pool-size=12
 * threadpool.event.queue-capacity=50
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private final Pool provider = new Pool(6, 12, 100, "provider-pool-");

    @Valid
    private final Pool event = new Pool(2, 4, 50, "event-pool-");

    @Valid
    private final Pool replay = new Pool(1, 1, 4, "replay-pool-");

    public Pool getProvider() {
        return provider;
    }

    public Pool getEvent() {
        return event;
    }

    public Pool getReplay() {
        return replay;
    }

    /**
     * One executor's settings. Defaults differ per pool and are set by the owner.
     */
    public static class Pool {

        @Min(1)
        private int corePoolSize;

        @Min(1)
        private int maxPoolSize;

        @Min(0)
        private int queueCapacity;

        @Min(0)
        private int keepAliveSeconds = 60;

        @NotBlank
        private String threadNamePrefix;

        Pool(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
