package com.orderdesk.oms;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of a preview. If ready, carries the intent the order will be submitted under and
 * the figures shown in the confirmation dialog. If blocked, {@code block} says why.
 */
@Getter
@Builder
public class OrderPreview {

    private final boolean ready;

    private final OrderBlock block;

    private final OrderIntent intent;

    private final BigDecimal effectivePrice;

    private final BuyingPowerImpact buyingPowerImpact;

    public static OrderPreview ready(OrderIntent intent, OrderCheckResult result) {
        return OrderPreview.builder()
                .ready(true)
                .intent(intent)
                .effectivePrice(result.getEffectivePrice())
                .buyingPowerImpact(result.getBuyingPowerImpact())
                .build();
    }

    public static OrderPreview blocked(OrderBlock block) {
        return OrderPreview.builder().ready(false).block(block).build();
    }
}
