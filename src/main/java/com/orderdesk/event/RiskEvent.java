package com.orderdesk.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a trading safety condition changes for an order-entry session.
 *
 * <p>Raised by the SafetyStateTracker when the kill switch or circuit breaker becomes
 * blocking, cannot be verified, or recovers, and by the OrderSubmissionPipeline when a
 * confirmed order is blocked at the final check.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>OrderEntryMetrics: counts safety transitions per event type</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String sessionId;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String sessionId, String message) {
        this(source, eventType, level, sessionId, message, null);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String sessionId,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.sessionId = sessionId;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>KILL_SWITCH_ENGAGED: {"switch": "KILL_SWITCH", "reason": "manual halt"}</li>
     *   <li>ORDER_BLOCKED: {"code": "CIRCUIT_BREAKER_TRIPPED", "symbol": "AAPL"}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
