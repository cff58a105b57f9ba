package com.orderdesk.client;

import java.math.BigDecimal;
import java.time.Instant;

public record FillRecord(
        String symbol, String side, BigDecimal qty, BigDecimal price, Instant filledAt, String clientOrderId) {}
