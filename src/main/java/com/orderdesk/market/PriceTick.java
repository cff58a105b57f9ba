package com.orderdesk.market;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A parsed {@code price.updated.{symbol}} message.
 *
 * @param symbol normalized symbol
 * @param price last trade price, null when missing, non-positive or non-finite
 * @param timestamp server timestamp, null when missing or unparsable, and always null when price is
 * @param eventType upstream event type, may be null
 * @param raw original payload for display consumers
 */
public record PriceTick(String symbol, BigDecimal price, Instant timestamp, String eventType, JsonNode raw) {

    public boolean isUsable() {
        return price != null && timestamp != null;
    }
}
