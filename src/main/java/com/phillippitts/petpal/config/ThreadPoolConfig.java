package com.phillippitts.petpal.config;

import com.phillippitts.petpal.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind command execution, notification fan-out and bounded
 * capability calls.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned in
 * application.properties.
 *
 * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy} for every pool. Callers handle the
 * rejection themselves: a command fails and an adapter call fails, so an HTTP thread never ends up
 * running command work. A rejected broadcast drain is the one exception and runs on the publishing
 * thread.
 *
 * <p>MDC propagation: copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker
 * thread to preserve request and command correlation IDs in async logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one {@code CommandExecutor} per accepted command. Configured via {@code threadpool.command.*}.
     */
    @Bean(name = "commandExecutor")
    public ThreadPoolTaskExecutor commandExecutor() {
        return buildExecutor(threadPoolProperties.getCommand());
    }

    /**
     * Runs the preemptive homing motion. Kept apart from {@link #commandExecutor()} because
     * interrupted executors may still occupy command threads until their adapter call returns.
     * Configured via {@code threadpool.safe-state.*}.
     */
    @Bean(name = "safeStateExecutor")
    public ThreadPoolTaskExecutor safeStateExecutor() {
        return buildExecutor(threadPoolProperties.getSafeState());
    }

    /**
     * Drains per-subscriber notification queues. Configured via {@code threadpool.broadcast.*}.
     */
    @Bean(name = "broadcastExecutor")
    public ThreadPoolTaskExecutor broadcastExecutor() {
        return buildExecutor(threadPoolProperties.getBroadcast());
    }

    /**
     * Runs capability adapter calls so the caller can wait with a timeout and cancel.
     * Configured via {@code threadpool.capability.*}.
     */
    @Bean(name = "capabilityExecutor")
    public ThreadPoolTaskExecutor capabilityExecutor() {
        return buildExecutor(threadPoolProperties.getCapability());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Decorator copying the submitter's ThreadContext into the worker and restoring the worker's
     * previous context afterwards.
     */
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
