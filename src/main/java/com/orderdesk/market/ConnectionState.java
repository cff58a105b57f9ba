package com.orderdesk.market;

import java.util.Locale;

/**
 * Bus connection states. Only {@link #CONNECTED} allows order submission; every other
 * state, including an unrecognized one, is read-only.
 */
public enum ConnectionState {
    CONNECTED,
    DEGRADED,
    DISCONNECTED,
    RECONNECTING,
    UNKNOWN;

    public boolean isReadWrite() {
        return this == CONNECTED;
    }

    /** Whether pub/sub delivery may have been lost while in this state. */
    public boolean isDisconnected() {
        return this == DISCONNECTED || this == RECONNECTING || this == UNKNOWN;
    }

    public static ConnectionState fromWire(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
