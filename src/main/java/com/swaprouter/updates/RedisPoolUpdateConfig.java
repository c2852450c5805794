package com.swaprouter.updates;

import com.swaprouter.config.SwapRouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;

/**
 * Subscribes the {@link PoolUpdateListener} to the Redis pub/sub channel.
 * Enabled with {@code swaprouter.updates.redis.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "swaprouter.updates.redis.enabled", havingValue = "true")
public class RedisPoolUpdateConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisPoolUpdateConfig.class);

    /**
     * Messages are dispatched on a single thread so updates are applied in the order received.
     */
    @Bean
    public ThreadPoolTaskExecutor poolUpdateExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("pool-update-");
        return executor;
    }

    @Bean
    public RedisMessageListenerContainer poolUpdateListenerContainer(RedisConnectionFactory connectionFactory,
                                                                     ThreadPoolTaskExecutor poolUpdateExecutor,
                                                                     PoolUpdateListener listener,
                                                                     SwapRouterProperties properties) {
        String channel = properties.getUpdates().getChannel();
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(poolUpdateExecutor);
        container.addMessageListener(
                (message, pattern) -> listener.onMessage(new String(message.getBody(), StandardCharsets.UTF_8)),
                new ChannelTopic(channel));
        log.info("Subscribing to pool updates on redis channel {}", channel);
        return container;
    }
}
