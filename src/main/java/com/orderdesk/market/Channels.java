package com.orderdesk.market;

/** Bus channel names consumed by order entry. */
public final class Channels {

    public static final String PRICE_PREFIX = "price.updated.";
    public static final String CONNECTION_STATE = "connection:state";

    private Channels() {}

    /** {@code symbol} must already be normalized by {@link SymbolValidator}. */
    public static String price(String symbol) {
        return PRICE_PREFIX + symbol;
    }

    public static String positions(String userId) {
        return "positions:" + userId;
    }
}
