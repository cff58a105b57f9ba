package com.orderdesk.oms;

import java.time.Instant;

/**
 * One distinct order-entry attempt. {@code intentId} is sent to the broker as the client
 * order ID so a retried submission of the same form is deduplicated downstream.
 */
public record OrderIntent(String intentId, OrderForm form, Instant createdAt) {

    public boolean matches(OrderForm other) {
        return form.equals(other);
    }
}
