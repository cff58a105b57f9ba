package com.orderdesk.oms;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Per-user trading limits served by the risk API.
 *
 * <p>{@code maxPositionPerSymbol} and {@code maxNotionalPerOrder} are always present in a
 * usable snapshot. A null {@code maxTotalExposure} means no portfolio exposure limit is
 * configured.
 */
@Data
@Builder
public class RiskLimits {

    /** Largest absolute share position allowed in any one symbol. */
    private final BigDecimal maxPositionPerSymbol;

    /** Largest {@code qty * effectivePrice} allowed for a single order. */
    private final BigDecimal maxNotionalPerOrder;

    /** Largest sum of absolute position notionals across the portfolio. Null = no limit. */
    private final BigDecimal maxTotalExposure;
}
