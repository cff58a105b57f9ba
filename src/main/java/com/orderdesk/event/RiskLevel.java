package com.orderdesk.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO for recoveries, WARNING for blocks the trader can resolve (stale data, limits),
 * CRITICAL for an engaged kill switch or tripped circuit breaker.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
