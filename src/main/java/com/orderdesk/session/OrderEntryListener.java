package com.orderdesk.session;

import com.orderdesk.client.FillRecord;
import com.orderdesk.market.ConnectionState;
import com.orderdesk.market.PositionBook;
import com.orderdesk.market.PriceTick;
import com.orderdesk.safety.SafetyState;
import java.util.List;

/**
 * Receives what an order-entry session observes. All methods default to no-op so a
 * consumer implements only what it renders.
 *
 * <p>Callbacks arrive on bus dispatch or executor threads, never concurrently for the
 * same channel.
 */
public interface OrderEntryListener {

    /** Every price tick on any subscribed price channel (watchlist rows). */
    default void onPriceTick(PriceTick tick) {}

    /** Price tick for the currently selected symbol only. */
    default void onSelectedPrice(PriceTick tick) {}

    default void onPositions(PositionBook positions) {}

    default void onSafetyState(SafetyState state) {}

    default void onConnectionState(ConnectionState state) {}

    /** The selected symbol is live; {@code symbol} is null when the selection was cleared. */
    default void onSymbolChanged(String symbol) {}

    default void onFills(List<FillRecord> fills) {}

    /** Trading is blocked for a reason outside any single order (e.g., failed initialization). */
    default void onTradingBlocked(String reason) {}
}
