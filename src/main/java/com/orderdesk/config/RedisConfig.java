package com.orderdesk.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for order entry.
 *
 * <p>Redis plays three roles:
 * <ul>
 *   <li>pub/sub bus for price ticks, positions, safety and connection state</li>
 *   <li>source of truth for kill switch and circuit breaker state (plain string JSON
 *       written by the risk service, read with {@link StringRedisTemplate})</li>
 *   <li>recovery store for in-progress order drafts (JSON via {@link RedisTemplate})</li>
 * </ul>
 *
 * <p>Key schema owned by this service:
 * <pre>
 *   orderdesk:pending-form:{sessionId} → pending order form map (TTL 24h)
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Global prefix for keys written by this service. */
    public static final String KEY_PREFIX = "orderdesk:";

    public static final String KEY_PREFIX_PENDING_FORM = KEY_PREFIX + "pending-form:";

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }

    /**
     * Listener container shared by all session buses. Listeners run on the subscription
     * thread in arrival order; {@link com.orderdesk.subscription.RedisMessageBus} hands each
     * message to a per-channel serial queue on the order entry executor.
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory redisConnectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(redisConnectionFactory);
        container.setTaskExecutor(new SyncTaskExecutor());
        return container;
    }
}
