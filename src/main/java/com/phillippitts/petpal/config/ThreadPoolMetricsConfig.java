package com.phillippitts.petpal.config;

import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.events.EventBuffer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for pool and pipeline gauges exposed via Micrometer.
 *
 * <p>Per pool ({@code command}, {@code safe-state}, {@code broadcast}, {@code capability}):
 * <ul>
 *   <li>petpal.pool.size - Current number of threads in the pool</li>
 *   <li>petpal.pool.active - Number of actively executing tasks</li>
 *   <li>petpal.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>petpal.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 *
 * <p>Plus {@code petpal.broadcast.subscribers} and {@code petpal.events.buffered}.
 *
 * <p>Additionally logs a pool summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ThreadPoolTaskExecutor> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(@Qualifier("commandExecutor") ThreadPoolTaskExecutor commandExecutor,
                                   @Qualifier("safeStateExecutor") ThreadPoolTaskExecutor safeStateExecutor,
                                   @Qualifier("broadcastExecutor") ThreadPoolTaskExecutor broadcastExecutor,
                                   @Qualifier("capabilityExecutor") ThreadPoolTaskExecutor capabilityExecutor) {
        pools.put("command", commandExecutor);
        pools.put("safe-state", safeStateExecutor);
        pools.put("broadcast", broadcastExecutor);
        pools.put("capability", capabilityExecutor);
    }

    @Bean
    public MeterBinder threadPoolMetrics() {
        return registry -> {
            pools.forEach((name, pool) -> bindPool(registry, name, pool.getThreadPoolExecutor()));
            LOG.info("Thread pool metrics registered for {}", pools.keySet());
        };
    }

    @Bean
    public MeterBinder pipelineMetrics(BroadcastHub hub, EventBuffer eventBuffer) {
        return registry -> {
            Gauge.builder("petpal.broadcast.subscribers", hub, BroadcastHub::subscriberCount)
                    .description("Connected push subscribers on this instance")
                    .register(registry);
            Gauge.builder("petpal.events.buffered", eventBuffer, EventBuffer::size)
                    .description("Events waiting for the next flush")
                    .register(registry);
        };
    }

    private static void bindPool(MeterRegistry registry, String name, ThreadPoolExecutor executor) {
        Gauge.builder("petpal.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", name)
                .register(registry);
        Gauge.builder("petpal.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", name)
                .register(registry);
        Gauge.builder("petpal.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", name)
                .register(registry);
        Gauge.builder("petpal.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", name)
                .register(registry);
    }

    /**
     * Logs pool health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        pools.forEach((name, pool) -> {
            ThreadPoolExecutor executor = pool.getThreadPoolExecutor();
            LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount());
        });
    }
}
