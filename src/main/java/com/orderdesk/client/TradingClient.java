package com.orderdesk.client;

import com.orderdesk.market.PositionBook;
import com.orderdesk.oms.RiskLimits;
import com.orderdesk.staleness.FieldSnapshot;
import java.math.BigDecimal;
import java.util.List;

/**
 * Execution gateway REST API.
 *
 * <p>Read methods return a {@link FieldSnapshot} stamped with the server's own timestamp;
 * a response without one yields a snapshot with no observation time. All methods throw
 * {@link com.orderdesk.exception.TransientIoException} on network or HTTP failure.
 */
public interface TradingClient {

    FieldSnapshot<PositionBook> fetchPositions(TraderIdentity identity);

    FieldSnapshot<BigDecimal> fetchBuyingPower(TraderIdentity identity);

    FieldSnapshot<RiskLimits> fetchRiskLimits(TraderIdentity identity);

    List<FillRecord> fetchRecentFills(TraderIdentity identity, int limit);

    SubmissionResponse submitOrder(TraderIdentity identity, OrderRequest request);
}
