package com.phillippitts.fleetdump.config;

import com.phillippitts.fleetdump.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors used by the fleet dump pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}. Every executor copies the
 * Log4j2 ThreadContext (MDC) from the submitting thread so {@code issueId} and {@code deviceId}
 * follow the work across threads.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs the supervision loop of each live dump job.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A supervision loop must never
     * run on the coordinator thread, so a saturated pool fails the job instead. The default maximum
     * is twice the concurrency cap: a backfilled job may start while the supervisor it replaces is
     * still reporting its outcome.
     */
    @Bean(name = "dumpJobExecutor")
    public Executor dumpJobExecutor() {
        return buildExecutor(threadPoolProperties.getJob(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Ships issue directories to the artifact store. Sized to a single worker by default so
     * uploads never compete with each other for bandwidth. A rejected upload is recorded as failed.
     */
    @Bean(name = "uploadExecutor")
    public Executor uploadExecutor() {
        return buildExecutor(threadPoolProperties.getUpload(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Backs the coordinator's serial command loop. Only one drain task is ever queued at a time.
     */
    @Bean(name = "coordinatorExecutor")
    public Executor coordinatorExecutor() {
        return buildExecutor(threadPoolProperties.getCoordinator(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
