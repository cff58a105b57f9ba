package com.orderdesk.oms;

import lombok.Builder;
import lombok.Getter;

/**
 * Terminal outcome of a confirm.
 *
 * <p>SUBMITTED: the gateway accepted the order. REJECTED: the gateway refused it or the
 * call failed; the intent is kept so a retry reuses it. ABORTED: a check blocked the order
 * before dispatch and {@code block} carries the reason.
 */
@Getter
@Builder
public class OrderSubmissionResult {

    private final OrderEntryState state;

    private final String intentId;

    private final OrderBlock block;

    /** Gateway status on SUBMITTED, rejection text on REJECTED. */
    private final String message;

    public static OrderSubmissionResult submitted(String intentId, String status) {
        return OrderSubmissionResult.builder()
                .state(OrderEntryState.SUBMITTED)
                .intentId(intentId)
                .message(status)
                .build();
    }

    public static OrderSubmissionResult rejected(String intentId, String message) {
        return OrderSubmissionResult.builder()
                .state(OrderEntryState.REJECTED)
                .intentId(intentId)
                .message(message)
                .build();
    }

    public static OrderSubmissionResult aborted(String intentId, OrderBlock block) {
        return OrderSubmissionResult.builder()
                .state(OrderEntryState.ABORTED)
                .intentId(intentId)
                .block(block)
                .message(block.getMessage())
                .build();
    }

    public boolean isSubmitted() {
        return state == OrderEntryState.SUBMITTED;
    }
}
