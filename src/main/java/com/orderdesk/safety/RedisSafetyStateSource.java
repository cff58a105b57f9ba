package com.orderdesk.safety;

import com.orderdesk.config.SafetyConfig;
import com.orderdesk.exception.TransientIoException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads safety state JSON straight from Redis, where the risk service writes it.
 *
 * <p>Key per switch comes from {@link SafetyConfig}. The blocking read runs on the order
 * entry executor so callers can apply a timeout without tying up their own thread.
 */
@Component
public class RedisSafetyStateSource implements SafetyStateSource {

    private final StringRedisTemplate stringRedisTemplate;
    private final SafetyConfig safetyConfig;
    private final Executor executor;

    public RedisSafetyStateSource(
            StringRedisTemplate stringRedisTemplate,
            SafetyConfig safetyConfig,
            @Qualifier("orderEntryExecutor") Executor executor) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.safetyConfig = safetyConfig;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Optional<String>> fetch(SafetySwitch safetySwitch) {
        String key = keyFor(safetySwitch);
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return Optional.ofNullable(stringRedisTemplate.opsForValue().get(key));
                    } catch (DataAccessException e) {
                        throw new TransientIoException("Failed to read " + key, e);
                    }
                },
                executor);
    }

    String keyFor(SafetySwitch safetySwitch) {
        return switch (safetySwitch) {
            case KILL_SWITCH -> safetyConfig.getKillSwitchKey();
            case CIRCUIT_BREAKER -> safetyConfig.getCircuitBreakerKey();
        };
    }
}
