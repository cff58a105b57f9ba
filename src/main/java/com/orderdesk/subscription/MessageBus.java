package com.orderdesk.subscription;

import java.util.concurrent.CompletableFuture;

/**
 * Pub/sub client used by a single order-entry session.
 *
 * <p>At most one handler is registered per channel: subscribing a channel that is already
 * subscribed replaces its handler rather than adding a second subscription. Futures
 * complete exceptionally with {@link com.orderdesk.exception.TransientIoException} on
 * network failure.
 */
public interface MessageBus {

    CompletableFuture<Void> subscribe(String channel, MessageHandler handler);

    CompletableFuture<Void> unsubscribe(String channel);
}
