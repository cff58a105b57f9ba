package com.orderdesk.oms;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Conservative per-share price used for position, notional, exposure and buying power math.
 *
 * <ul>
 *   <li>MARKET: last trade price</li>
 *   <li>LIMIT, STOP_LIMIT: the limit price</li>
 *   <li>STOP: {@code max(stopPrice, lastPrice)} for buys and sells alike, so neither a
 *       gap through the stop nor a fill above it is under-counted</li>
 * </ul>
 *
 * <p>Empty when a required input is missing. A stop order without a usable last price has
 * no effective price.
 */
public final class EffectivePriceCalculator {

    private EffectivePriceCalculator() {}

    public static Optional<BigDecimal> effectivePrice(
            OrderType orderType, BigDecimal limitPrice, BigDecimal stopPrice, BigDecimal lastPrice) {
        if (orderType == null) {
            return Optional.empty();
        }
        return switch (orderType) {
            case MARKET -> Optional.ofNullable(lastPrice);
            case LIMIT, STOP_LIMIT -> Optional.ofNullable(limitPrice);
            case STOP -> stopPrice == null || lastPrice == null
                    ? Optional.empty()
                    : Optional.of(stopPrice.max(lastPrice));
        };
    }

    public static Optional<BigDecimal> effectivePrice(OrderForm form, BigDecimal lastPrice) {
        return effectivePrice(form.orderType(), form.limitPrice(), form.stopPrice(), lastPrice);
    }
}
