package com.phillippitts.petpal.config.broadcast;

import com.phillippitts.petpal.config.properties.BroadcastProperties;
import com.phillippitts.petpal.service.broadcast.BroadcastHub;
import com.phillippitts.petpal.service.broadcast.NoopSharedBus;
import com.phillippitts.petpal.service.broadcast.NotificationCodec;
import com.phillippitts.petpal.service.broadcast.RedisSharedBus;
import com.phillippitts.petpal.service.broadcast.SharedBus;
import com.phillippitts.petpal.service.broadcast.SharedBusListener;
import com.phillippitts.petpal.service.metrics.BroadcastMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the broadcast hub and, when {@code petpal.broadcast.bus.enabled=true}, the Redis-backed
 * shared bus with its inbound listener.
 */
@Configuration
public class BroadcastConfig {

    private static final Logger LOG = LogManager.getLogger(BroadcastConfig.class);

    private final BroadcastProperties props;

    public BroadcastConfig(BroadcastProperties props) {
        this.props = props;
    }

    @Bean
    public NotificationCodec notificationCodec() {
        return new NotificationCodec();
    }

    @Bean
    public BroadcastHub broadcastHub(@Qualifier("broadcastExecutor") Executor broadcastExecutor,
                                     SharedBus sharedBus,
                                     BroadcastMetrics metrics) {
        return new BroadcastHub(broadcastExecutor, props.getSubscriberQueueCapacity(), sharedBus, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "petpal.broadcast.bus", name = "enabled", havingValue = "false",
            matchIfMissing = true)
    public SharedBus localOnlyBus() {
        LOG.info("Shared bus disabled; broadcasting to local subscribers only");
        return NoopSharedBus.INSTANCE;
    }

    /**
     * Multi-instance fan-out. Beans below only exist when the bus is enabled.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "petpal.broadcast.bus", name = "enabled", havingValue = "true")
    static class RedisBusConfig {

        private final BroadcastProperties props;
        private final String instanceId;

        RedisBusConfig(BroadcastProperties props) {
            this.props = props;
            String configured = props.getBus().getInstanceId();
            this.instanceId = configured == null || configured.isBlank() ? UUID.randomUUID().toString() : configured;
        }

        /**
         * Single worker so bus publishes keep their local order.
         */
        @Bean(name = "busForwarderExecutor")
        ThreadPoolTaskExecutor busForwarderExecutor() {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(1);
            executor.setMaxPoolSize(1);
            executor.setQueueCapacity(1000);
            executor.setThreadNamePrefix("bus-forwarder-");
            executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
            executor.initialize();
            return executor;
        }

        @Bean
        SharedBus redisSharedBus(StringRedisTemplate redisTemplate,
                                 NotificationCodec codec,
                                 @Qualifier("busForwarderExecutor") Executor forwarder,
                                 ApplicationEventPublisher publisher) {
            LOG.info("Shared bus enabled: channel={}, instanceId={}", props.getBus().getChannel(), instanceId);
            return new RedisSharedBus(redisTemplate, props.getBus().getChannel(), instanceId, codec, forwarder,
                    publisher);
        }

        @Bean
        SharedBusListener sharedBusListener(BroadcastHub hub, NotificationCodec codec) {
            return new SharedBusListener(hub, codec, instanceId);
        }

        @Bean
        RedisMessageListenerContainer busListenerContainer(RedisConnectionFactory connectionFactory,
                                                          SharedBusListener listener) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.addMessageListener(listener, new ChannelTopic(props.getBus().getChannel()));
            return container;
        }
    }
}
