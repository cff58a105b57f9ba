package com.orderdesk.subscription;

import com.orderdesk.exception.TransientIoException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * {@link MessageBus} over Redis pub/sub for one session.
 *
 * <p>Two per-channel queues run on the order entry executor:
 * <ul>
 *   <li>operations: subscribe/unsubscribe of a channel apply in call order</li>
 *   <li>dispatch: handler calls for a channel run one at a time in arrival order, while
 *       different channels dispatch concurrently</li>
 * </ul>
 */
public class RedisMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(RedisMessageBus.class);

    private final RedisMessageListenerContainer listenerContainer;
    private final Executor executor;

    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> operationTails = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> dispatchTails = new ConcurrentHashMap<>();

    public RedisMessageBus(RedisMessageListenerContainer listenerContainer, Executor executor) {
        this.listenerContainer = listenerContainer;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> subscribe(String channel, MessageHandler handler) {
        return enqueueOperation(channel, () -> {
            ChannelTopic topic = ChannelTopic.of(channel);
            MessageListener listener = (message, pattern) ->
                    dispatch(channel, handler, new String(message.getBody(), StandardCharsets.UTF_8));
            MessageListener previous = listeners.put(channel, listener);
            if (previous != null) {
                listenerContainer.removeMessageListener(previous, topic);
            }
            listenerContainer.addMessageListener(listener, topic);
            log.debug("Subscribed to {}", channel);
        });
    }

    @Override
    public CompletableFuture<Void> unsubscribe(String channel) {
        return enqueueOperation(channel, () -> {
            MessageListener listener = listeners.remove(channel);
            if (listener != null) {
                listenerContainer.removeMessageListener(listener, ChannelTopic.of(channel));
                dispatchTails.remove(channel);
                log.debug("Unsubscribed from {}", channel);
            }
        });
    }

    private CompletableFuture<Void> enqueueOperation(String channel, Runnable operation) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        operationTails.compute(channel, (key, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.handle((ignored, error) -> null).thenRunAsync(() -> {
                try {
                    operation.run();
                    result.complete(null);
                } catch (RuntimeException e) {
                    result.completeExceptionally(new TransientIoException("Redis pub/sub operation failed for " + channel, e));
                }
            }, executor);
        });
        return result;
    }

    private void dispatch(String channel, MessageHandler handler, String payload) {
        dispatchTails.compute(channel, (key, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(() -> {
                try {
                    handler.onMessage(payload);
                } catch (RuntimeException e) {
                    log.error("Handler for {} failed", channel, e);
                }
            }, executor);
        });
    }
}
