package com.orderdesk.client;

import java.util.Locale;
import java.util.Set;

/** Gateway reply to an order submission. */
public record SubmissionResponse(String status, String clientOrderId, String message) {

    private static final Set<String> ACCEPTED_STATUSES = Set.of("pending_new", "new", "accepted");

    public boolean isAccepted() {
        return status != null && ACCEPTED_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }
}
