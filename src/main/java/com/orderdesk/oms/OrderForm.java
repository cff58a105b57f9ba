package com.orderdesk.oms;

import com.orderdesk.market.Decimals;
import java.math.BigDecimal;
import java.util.Locale;
import lombok.Builder;

/**
 * The order ticket as the trader filled it in. Fields may be missing or invalid;
 * {@link OrderFormValidator} reports what is wrong.
 *
 * <p>Symbol is trimmed and upper-cased and decimals are stripped of trailing zeros, so two
 * forms that describe the same order are {@code equals}. Intent reuse relies on that.
 */
@Builder(toBuilder = true)
public record OrderForm(
        String symbol,
        OrderSide side,
        BigDecimal quantity,
        OrderType orderType,
        BigDecimal limitPrice,
        BigDecimal stopPrice,
        TimeInForce timeInForce) {

    public OrderForm {
        symbol = symbol == null || symbol.isBlank() ? null : symbol.trim().toUpperCase(Locale.ROOT);
        quantity = Decimals.normalize(quantity);
        limitPrice = Decimals.normalize(limitPrice);
        stopPrice = Decimals.normalize(stopPrice);
    }
}
