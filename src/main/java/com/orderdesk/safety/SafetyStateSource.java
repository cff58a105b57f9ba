package com.orderdesk.safety;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Source of truth for kill switch and circuit breaker state.
 *
 * <p>Returns the raw stored payload, or empty when nothing is stored. The future completes
 * exceptionally on I/O failure; callers bound it with their own timeout.
 */
public interface SafetyStateSource {

    CompletableFuture<Optional<String>> fetch(SafetySwitch safetySwitch);
}
