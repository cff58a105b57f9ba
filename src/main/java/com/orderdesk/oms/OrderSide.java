package com.orderdesk.oms;

import java.util.Locale;
import java.util.Optional;

public enum OrderSide {
    BUY,
    SELL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<OrderSide> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (OrderSide side : values()) {
            if (side.wireValue().equalsIgnoreCase(raw.trim())) {
                return Optional.of(side);
            }
        }
        return Optional.empty();
    }
}
