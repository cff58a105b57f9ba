package com.orderdesk.client;

import com.orderdesk.oms.OrderForm;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order submission body. {@code clientOrderId} is the session's intent ID and acts as the
 * broker idempotency key.
 */
public record OrderRequest(
        String symbol,
        String side,
        BigDecimal qty,
        String orderType,
        BigDecimal limitPrice,
        BigDecimal stopPrice,
        String timeInForce,
        String clientOrderId) {

    public static OrderRequest from(OrderForm form, String intentId) {
        return new OrderRequest(
                form.symbol(),
                form.side().wireValue(),
                form.quantity(),
                form.orderType().wireValue(),
                form.limitPrice(),
                form.stopPrice(),
                form.timeInForce().wireValue(),
                intentId);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", symbol);
        payload.put("side", side);
        payload.put("qty", qty);
        payload.put("order_type", orderType);
        payload.put("time_in_force", timeInForce);
        payload.put("client_order_id", clientOrderId);
        if (limitPrice != null) {
            payload.put("limit_price", limitPrice.toPlainString());
        }
        if (stopPrice != null) {
            payload.put("stop_price", stopPrice.toPlainString());
        }
        return payload;
    }
}
