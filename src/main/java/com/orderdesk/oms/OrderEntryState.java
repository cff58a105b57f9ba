package com.orderdesk.oms;

/**
 * Order pipeline states: DRAFTING to PREVIEWING to CONFIRMING, ending in SUBMITTED,
 * REJECTED or ABORTED. A new preview may start from any terminal state.
 */
public enum OrderEntryState {
    DRAFTING,
    PREVIEWING,
    CONFIRMING,
    SUBMITTED,
    REJECTED,
    ABORTED;

    public boolean isTerminal() {
        return this == SUBMITTED || this == REJECTED || this == ABORTED;
    }
}
