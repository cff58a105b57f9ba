package com.orderdesk.staleness;

/** Safety-relevant values whose age is checked before an order may be submitted. */
public enum DataField {
    POSITION,
    PRICE,
    BUYING_POWER,
    RISK_LIMITS
}
