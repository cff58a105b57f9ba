package com.orderdesk.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the OrderSubmissionPipeline on each terminal outcome of an order attempt.
 */
public class OrderEntryEvent extends ApplicationEvent {

    private final OrderEntryEventType eventType;
    private final String sessionId;
    private final String intentId;
    private final String symbol;
    private final String detail;

    public OrderEntryEvent(
            Object source,
            OrderEntryEventType eventType,
            String sessionId,
            String intentId,
            String symbol,
            String detail) {
        super(source);
        this.eventType = eventType;
        this.sessionId = sessionId;
        this.intentId = intentId;
        this.symbol = symbol;
        this.detail = detail;
    }

    public OrderEntryEventType getEventType() {
        return eventType;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getIntentId() {
        return intentId;
    }

    public String getSymbol() {
        return symbol;
    }

    /** Block code, broker rejection message or accepted status. */
    public String getDetail() {
        return detail;
    }
}
