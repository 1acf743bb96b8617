package com.phillippitts.petpal.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Four pools: {@code command} runs command executors, {@code safeState} runs the preemptive
 * homing motion, {@code broadcast} drains subscriber queues and {@code capability} runs bounded
 * adapter calls.
 *
 * <p>{@code safeState} defaults to a queue capacity of 0 (direct hand-off): homing starts on a fresh
 * thread or is rejected, it never waits behind other work.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties command = new PoolProperties(2, 4, 8, "command-");
    private PoolProperties safeState = new PoolProperties(1, 4, 0, "safe-state-");
    private PoolProperties broadcast = new PoolProperties(2, 8, 1000, "broadcast-");
    private PoolProperties capability = new PoolProperties(4, 16, 32, "capability-");

    public PoolProperties getCommand() {
        return command;
    }

    public void setCommand(PoolProperties command) {
        this.command = command;
    }

    public PoolProperties getSafeState() {
        return safeState;
    }

    public void setSafeState(PoolProperties safeState) {
        this.safeState = safeState;
    }

    public PoolProperties getBroadcast() {
        return broadcast;
    }

    public void setBroadcast(PoolProperties broadcast) {
        this.broadcast = broadcast;
    }

    public PoolProperties getCapability() {
        return capability;
    }

    public void setCapability(PoolProperties capability) {
        this.capability = capability;
    }

    /**
     * Sizing of a single pool.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
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
