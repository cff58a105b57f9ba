package com.orderdesk.oms;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of a validation pass: PASSED with the computed order figures, or BLOCKED with
 * the first failing check. Checks run in a fixed order so the trader always sees the most
 * fundamental problem first.
 */
@Getter
public class OrderCheckResult {

    private final boolean passed;
    private final OrderBlock block;
    private final BigDecimal effectivePrice;
    private final BuyingPowerImpact buyingPowerImpact;

    private OrderCheckResult(boolean passed, OrderBlock block, BigDecimal effectivePrice, BuyingPowerImpact impact) {
        this.passed = passed;
        this.block = block;
        this.effectivePrice = effectivePrice;
        this.buyingPowerImpact = impact;
    }

    public static OrderCheckResult passed(BigDecimal effectivePrice, BuyingPowerImpact impact) {
        return new OrderCheckResult(true, null, effectivePrice, impact);
    }

    public static OrderCheckResult blocked(OrderBlock block) {
        return new OrderCheckResult(false, block, null, null);
    }

    public boolean isBlocked() {
        return !passed;
    }
}
