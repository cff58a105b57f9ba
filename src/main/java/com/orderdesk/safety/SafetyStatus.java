package com.orderdesk.safety;

/**
 * Classification of a safety switch. Only {@link #SAFE} permits order submission;
 * {@link #TRANSITIONAL} (circuit breaker quiet period) blocks exactly like {@link #UNSAFE}.
 */
public enum SafetyStatus {
    SAFE,
    UNSAFE,
    TRANSITIONAL;

    public boolean isBlocking() {
        return this != SAFE;
    }
}
