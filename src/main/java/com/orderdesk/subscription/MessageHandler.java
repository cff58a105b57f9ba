package com.orderdesk.subscription;

/**
 * Receives raw JSON payloads for one bus channel. Calls for a given channel never overlap.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(String payload);
}
