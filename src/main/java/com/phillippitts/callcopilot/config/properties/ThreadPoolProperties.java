package com.phillippitts.callcopilot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides sizing for the fan-out executor (intent, KB, disposition and forwarding
 * work), the scheduler that times retry backoff, and the shared HTTP pool used by
 * transcription pipelines.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private FanoutPoolProperties fanout = new FanoutPoolProperties();
    private RetryPoolProperties retry = new RetryPoolProperties();
    private HttpPoolProperties http = new HttpPoolProperties();

    public FanoutPoolProperties getFanout() {
        return fanout;
    }

    public void setFanout(FanoutPoolProperties fanout) {
        this.fanout = fanout;
    }

    public RetryPoolProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryPoolProperties retry) {
        this.retry = retry;
    }

    public HttpPoolProperties getHttp() {
        return http;
    }

    public void setHttp(HttpPoolProperties http) {
        this.http = http;
    }

    /**
     * Fan-out executor pool configuration.
     */
    public static class FanoutPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "fanout-";

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

    /**
     * Retry backoff scheduler configuration.
     */
    public static class RetryPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "retry-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Shared pipeline HTTP client pool configuration.
     */
    public static class HttpPoolProperties {
        private int poolSize = 8;
        private String threadNamePrefix = "pipeline-http-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
