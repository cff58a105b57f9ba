package com.orderdesk.oms;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * What an order would consume of available buying power.
 *
 * @param notional order value at the effective price
 * @param percentage notional as a percentage of buying power, null when buying power is unknown or not positive
 * @param remaining buying power left after the order, null when unknown
 * @param warning true above half of buying power, or when buying power is unknown
 */
public record BuyingPowerImpact(BigDecimal notional, BigDecimal percentage, BigDecimal remaining, boolean warning) {

    static final BigDecimal WARNING_PERCENT = BigDecimal.valueOf(50);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static BuyingPowerImpact of(BigDecimal notional, BigDecimal buyingPower) {
        if (buyingPower == null || buyingPower.signum() <= 0) {
            return new BuyingPowerImpact(notional, null, null, true);
        }
        BigDecimal percentage = notional.multiply(HUNDRED).divide(buyingPower, 4, RoundingMode.HALF_UP);
        return new BuyingPowerImpact(
                notional, percentage, buyingPower.subtract(notional), percentage.compareTo(WARNING_PERCENT) > 0);
    }
}
