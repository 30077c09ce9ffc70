package com.phillippitts.fleetdump.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <ul>
 *   <li>{@code threadpool.job} - supervises running extraction scripts, one thread per live job</li>
 *   <li>{@code threadpool.upload} - ships issue directories to the artifact store, one at a time</li>
 *   <li>{@code threadpool.coordinator} - single thread that serializes fleet state mutations</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties job = new PoolProperties(8, 32, 0, "dump-job-");
    private PoolProperties upload = new PoolProperties(1, 1, 10, "dump-upload-");
    private PoolProperties coordinator = new PoolProperties(1, 1, Integer.MAX_VALUE, "fleet-coordinator-");

    public PoolProperties getJob() {
        return job;
    }

    public void setJob(PoolProperties job) {
        this.job = job;
    }

    public PoolProperties getUpload() {
        return upload;
    }

    public void setUpload(PoolProperties upload) {
        this.upload = upload;
    }

    public PoolProperties getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(PoolProperties coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Sizing for one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
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
