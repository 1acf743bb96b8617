package com.phillippitts.petpal.config;

import com.phillippitts.petpal.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateCommandExecutorWithDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        executor = config.commandExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("command-");
    }

    @Test
    void shouldHandSafeStateWorkDirectlyToAThread() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        executor = config.safeStateExecutor();

        assertThat(executor.getQueueCapacity()).isZero();
        assertThat(executor.getThreadPoolExecutor().getQueue().remainingCapacity()).isZero();
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("safe-state-");
    }

    @Test
    void shouldUseDistinctPrefixPerPool() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor broadcast = config.broadcastExecutor();
        ThreadPoolTaskExecutor capability = config.capabilityExecutor();
        try {
            assertThat(broadcast.getThreadNamePrefix()).isEqualTo("broadcast-");
            assertThat(capability.getThreadNamePrefix()).isEqualTo("capability-");
        } finally {
            broadcast.shutdown();
            capability.shutdown();
        }
    }

    @Test
    void shouldRejectWhenSaturated() throws InterruptedException {
        // Arrange
        ThreadPoolProperties properties = new ThreadPoolProperties();
        ThreadPoolProperties.PoolProperties tiny = new ThreadPoolProperties.PoolProperties();
        tiny.setCorePoolSize(1);
        tiny.setMaxPoolSize(1);
        tiny.setQueueCapacity(1);
        tiny.setThreadNamePrefix("tiny-");
        properties.setCommand(tiny);
        executor = new ThreadPoolConfig(properties).commandExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        Runnable blocker = () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        // Act
        executor.execute(blocker);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        executor.execute(blocker);

        // Assert
        try {
            assertThatThrownBy(() -> executor.execute(blocker)).isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        // Arrange
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).commandExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        ThreadContext.put("commandId", "cmd-7");

        // Act
        executor.execute(() -> {
            seen.set(ThreadContext.get("commandId"));
            done.countDown();
        });

        // Assert
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("cmd-7");
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        // Arrange
        ThreadContext.put("commandId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("commandId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "yes");

        // Act
        decorated.run();

        // Assert
        assertThat(ThreadContext.get("commandId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("yes");
    }
}
