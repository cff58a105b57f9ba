package com.orderdesk.oms;

import java.math.BigDecimal;

/**
 * Projected portfolio exposure after an order:
 * {@code newTotal = currentTotal - currentSymbolNotional + proposedSymbolNotional}.
 *
 * <p>Both current figures must come from the same position set, so the result equals a
 * from-scratch sum of the book with the symbol's row replaced.
 */
public final class ExposureCalculator {

    private ExposureCalculator() {}

    public static BigDecimal projectedExposure(
            BigDecimal currentTotal,
            BigDecimal currentSymbolNotional,
            BigDecimal proposedPosition,
            BigDecimal effectivePrice) {
        BigDecimal proposedSymbolNotional = proposedPosition.multiply(effectivePrice).abs();
        return currentTotal.subtract(currentSymbolNotional).add(proposedSymbolNotional);
    }

    /**
     * Shares of the order that open or add to a position. A sell against a long (or a buy
     * against a short) first closes up to the held quantity; only the remainder opens.
     */
    public static BigDecimal openingQuantity(BigDecimal currentPosition, OrderSide side, BigDecimal quantity) {
        boolean reduces = side == OrderSide.SELL ? currentPosition.signum() > 0 : currentPosition.signum() < 0;
        if (!reduces) {
            return quantity;
        }
        return quantity.subtract(quantity.min(currentPosition.abs()));
    }

    public static BigDecimal proposedPosition(BigDecimal currentPosition, OrderSide side, BigDecimal quantity) {
        return side == OrderSide.SELL ? currentPosition.subtract(quantity) : currentPosition.add(quantity);
    }
}
