package com.orderdesk.oms;

import java.util.Locale;
import java.util.Optional;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    FOK;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TimeInForce> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (TimeInForce tif : values()) {
            if (tif.wireValue().equalsIgnoreCase(raw.trim())) {
                return Optional.of(tif);
            }
        }
        return Optional.empty();
    }
}
