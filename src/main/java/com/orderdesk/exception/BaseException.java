package com.orderdesk.exception;

import java.util.Map;
import java.util.concurrent.CompletionException;
import lombok.Getter;

/**
 * Root of the order-entry failure taxonomy. Carries an {@link ErrorCode} and the channel,
 * session or owner identifiers that locate the failure.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    /**
     * Classifies a failure, looking through {@link CompletionException} wrappers. Failures
     * outside the taxonomy (bus driver errors, timeouts) count as retryable.
     */
    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return !(current instanceof BaseException base) || base.isRetryable();
    }
}
