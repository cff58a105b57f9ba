package com.orderdesk.oms;

import com.orderdesk.market.Decimals;
import com.orderdesk.market.SymbolValidator;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Structural checks on the ticket: symbol, side, quantity, time in force and the prices
 * each order type needs. Stop-limit buys need {@code limit <= stop}, sells {@code limit >= stop}.
 */
public final class OrderFormValidator {

    private OrderFormValidator() {}

    public static Optional<OrderBlock> validate(OrderForm form) {
        if (form.symbol() == null) {
            return block("SYMBOL_REQUIRED", "Select a symbol");
        }
        if (SymbolValidator.tryNormalize(form.symbol()).isEmpty()) {
            return block("INVALID_SYMBOL", "Invalid symbol format");
        }
        if (form.side() == null) {
            return block("SIDE_REQUIRED", "Select buy or sell");
        }
        BigDecimal quantity = form.quantity();
        if (quantity == null || quantity.signum() <= 0) {
            return block("QUANTITY_REQUIRED", "Enter quantity");
        }
        if (!Decimals.withinRange(quantity)) {
            return block("INVALID_QUANTITY", "Quantity is out of range");
        }
        if (quantity.scale() > 0) {
            return block("INVALID_QUANTITY", "Quantity must be a whole number of shares");
        }
        if (form.orderType() == null) {
            return block("ORDER_TYPE_REQUIRED", "Select an order type");
        }
        if (form.timeInForce() == null) {
            return block("TIME_IN_FORCE_REQUIRED", "Select a time in force");
        }
        return validatePrices(form);
    }

    static Optional<OrderBlock> validatePrices(OrderForm form) {
        BigDecimal limit = form.limitPrice();
        BigDecimal stop = form.stopPrice();
        if (limit != null && !Decimals.withinRange(limit)) {
            return block("INVALID_LIMIT_PRICE", "Limit price is out of range");
        }
        if (stop != null && !Decimals.withinRange(stop)) {
            return block("INVALID_STOP_PRICE", "Stop price is out of range");
        }
        switch (form.orderType()) {
            case MARKET:
                return Optional.empty();
            case LIMIT:
                if (limit == null) {
                    return block("LIMIT_PRICE_REQUIRED", "Limit orders require a limit price");
                }
                return limit.signum() > 0 ? Optional.empty() : block("INVALID_LIMIT_PRICE", "Limit price must be positive");
            case STOP:
                if (stop == null) {
                    return block("STOP_PRICE_REQUIRED", "Stop orders require a stop price");
                }
                return stop.signum() > 0 ? Optional.empty() : block("INVALID_STOP_PRICE", "Stop price must be positive");
            case STOP_LIMIT:
                if (limit == null) {
                    return block("LIMIT_PRICE_REQUIRED", "Stop-limit orders require a limit price");
                }
                if (limit.signum() <= 0) {
                    return block("INVALID_LIMIT_PRICE", "Limit price must be positive");
                }
                if (stop == null) {
                    return block("STOP_PRICE_REQUIRED", "Stop-limit orders require a stop price");
                }
                if (stop.signum() <= 0) {
                    return block("INVALID_STOP_PRICE", "Stop price must be positive");
                }
                if (form.side() == OrderSide.BUY && limit.compareTo(stop) > 0) {
                    return block(
                            "INVALID_STOP_LIMIT",
                            "Buy stop-limit: limit ($" + limit.toPlainString() + ") must be at or below stop ($"
                                    + stop.toPlainString() + ")");
                }
                if (form.side() == OrderSide.SELL && limit.compareTo(stop) < 0) {
                    return block(
                            "INVALID_STOP_LIMIT",
                            "Sell stop-limit: limit ($" + limit.toPlainString() + ") must be at or above stop ($"
                                    + stop.toPlainString() + ")");
                }
                return Optional.empty();
            default:
                return block("ORDER_TYPE_REQUIRED", "Unsupported order type");
        }
    }

    private static Optional<OrderBlock> block(String code, String message) {
        return Optional.of(OrderBlock.validation(code, message));
    }
}
