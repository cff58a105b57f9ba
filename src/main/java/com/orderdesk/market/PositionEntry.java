package com.orderdesk.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of a positions payload. {@code qty} is signed (short positions are negative).
 * {@code currentPrice} is null when the server omitted it or sent a non-finite value.
 */
public record PositionEntry(String symbol, BigDecimal qty, BigDecimal currentPrice, Instant updatedAt) {

    /** Absolute market value, or null when the price is unknown. */
    public BigDecimal notional() {
        return currentPrice == null ? null : qty.multiply(currentPrice).abs();
    }
}
