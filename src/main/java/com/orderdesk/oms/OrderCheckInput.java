package com.orderdesk.oms;

import com.orderdesk.market.PositionBook;
import com.orderdesk.safety.SafetyState;
import com.orderdesk.staleness.FieldSnapshot;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything one validation pass looks at. The preview pass fills it from the session
 * cache; the confirm pass fills it from fresh fetches and authoritative safety reads.
 */
@Getter
@Builder
public class OrderCheckInput {

    private final OrderForm form;
    private final boolean safetyInitialized;
    private final boolean connectionReadWrite;
    private final SafetyState killSwitch;
    private final SafetyState circuitBreaker;
    private final FieldSnapshot<PositionBook> positions;
    private final FieldSnapshot<BigDecimal> lastPrice;
    private final FieldSnapshot<BigDecimal> buyingPower;
    private final FieldSnapshot<RiskLimits> riskLimits;
}
