package com.orderdesk.event;

public enum OrderEntryEventType {
    SUBMITTED,
    REJECTED,
    BLOCKED,
    ABORTED
}
