package com.orderdesk.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure taxonomy for order entry.
 *
 * <p>Only {@link #TRANSIENT_IO} is retryable. Validation and safety failures are reported
 * to the trader as blocks; programming invariants indicate a caller bug.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    TRANSIENT_IO("TRANSIENT_IO", true),
    VALIDATION_FAILURE("VALIDATION_FAILURE", false),
    SAFETY_BLOCKED("SAFETY_BLOCKED", false),
    PROGRAMMING_INVARIANT("PROGRAMMING_INVARIANT", false),
    SESSION_DISPOSED("SESSION_DISPOSED", false);

    private final String code;
    private final boolean retryable;
}
