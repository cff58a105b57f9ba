package com.orderdesk.oms;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported order types. The effective price used in limit checks depends on the type;
 * see {@link EffectivePriceCalculator}.
 */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT;

    public boolean requiresLimitPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP || this == STOP_LIMIT;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<OrderType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (OrderType type : values()) {
            if (type.wireValue().equalsIgnoreCase(raw.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
