package com.orderdesk.market;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Last known bus connection state for a session. Starts with no state, which counts as
 * disconnected for reconnect detection and read-only for order submission.
 */
public class ConnectionTracker {

    private final AtomicReference<ConnectionState> state = new AtomicReference<>();

    /**
     * Records {@code next} and reports whether it restores a lost connection: a move to
     * CONNECTED from no state, DISCONNECTED, RECONNECTING or UNKNOWN. DEGRADED to CONNECTED
     * is not a reconnect because pub/sub delivery was never lost.
     */
    public boolean apply(ConnectionState next) {
        ConnectionState previous = state.getAndSet(next);
        return next == ConnectionState.CONNECTED && (previous == null || previous.isDisconnected());
    }

    public ConnectionState current() {
        ConnectionState current = state.get();
        return current != null ? current : ConnectionState.UNKNOWN;
    }

    public boolean isReadWrite() {
        ConnectionState current = state.get();
        return current != null && current.isReadWrite();
    }
}
