package com.phillippitts.grillstats.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the device poll workers, the stream dispatch workers and the
 * historical-store forwarder. Defaults are conservative but can be adjusted per deployment.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties poll = new PoolProperties(4, 16, 64, "poll-pool-");
    private PoolProperties dispatch = new PoolProperties(2, 8, 1_000, "dispatch-pool-");
    private PoolProperties history = new PoolProperties(1, 2, 5_000, "history-pool-");

    public PoolProperties getPoll() {
        return poll;
    }

    public void setPoll(PoolProperties poll) {
        this.poll = poll;
    }

    public PoolProperties getDispatch() {
        return dispatch;
    }

    public void setDispatch(PoolProperties dispatch) {
        this.dispatch = dispatch;
    }

    public PoolProperties getHistory() {
        return history;
    }

    public void setHistory(PoolProperties history) {
        this.history = history;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 100, "pool-");
        }

        public PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
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
