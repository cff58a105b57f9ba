package com.orderdesk.event;

/**
 * Classifies the safety condition that triggered a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Kill switch reported as engaged by a well-formed state. */
    KILL_SWITCH_ENGAGED,

    /** Circuit breaker reported as tripped or in its quiet period. */
    CIRCUIT_BREAKER_TRIPPED,

    /** A safety switch could not be verified (timeout, malformed payload, missing timestamp). */
    SAFETY_STATE_UNVERIFIED,

    /** A safety switch returned to a verified safe state. */
    SAFETY_STATE_RESTORED,

    /** An order was blocked during confirm-time or final pre-dispatch validation. */
    ORDER_BLOCKED
}
